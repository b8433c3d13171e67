package com.jobJumper.careerAi.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free-text document (cover letter, interview guide, negotiation plan, rewritten resume section).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeneratedDocument {

    private DocumentKind kind;

    /**
     * Cleaned document text; the kind's placeholder when generation failed.
     */
    private String content;
}
