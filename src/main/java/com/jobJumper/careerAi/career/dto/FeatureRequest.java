package com.jobJumper.careerAi.career.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for model-backed career features.
 * Prompts are built by the client; this service only sends them and normalizes the answer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeatureRequest {

    /**
     * Optional system instruction.
     */
    private String systemPrompt;

    @NotBlank(message = "prompt cannot be blank")
    private String prompt;
}
