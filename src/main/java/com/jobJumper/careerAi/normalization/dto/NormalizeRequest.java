package com.jobJumper.careerAi.normalization.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO carrying model text the client already holds.
 * Blank or missing text is accepted and handled as a structural failure.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NormalizeRequest {

    private String rawText;
}
