package com.jobJumper.careerAi.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Resume-to-job match score report.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchScoreReport {

    /**
     * Match score, rounded to a whole number. 0 when absent or not numeric.
     */
    private int score;

    private String summary;

    private List<String> strengths;

    private List<String> gaps;

    private List<String> recommendations;
}
