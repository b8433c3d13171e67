package com.jobJumper.careerAi.career.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for rewriting one resume section (summary, experience or project text).
 * The original text is returned unchanged when the rewrite fails.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResumeSectionRequest {

    private String systemPrompt;

    @NotBlank(message = "prompt cannot be blank")
    private String prompt;

    private String originalText;
}
