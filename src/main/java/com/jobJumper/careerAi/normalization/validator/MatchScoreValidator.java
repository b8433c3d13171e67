package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobJumper.careerAi.normalization.model.MatchScoreReport;
import org.springframework.stereotype.Component;

/**
 * Strict validator for {@link MatchScoreReport}.
 */
@Component
public class MatchScoreValidator extends AbstractResponseValidator<MatchScoreReport> {

    @Override
    public String getShapeName() {
        return "match-score";
    }

    @Override
    public MatchScoreReport validate(JsonNode value) {
        return MatchScoreReport.builder()
                .score(wholeNumber(value, "score"))
                .summary(text(value, "summary"))
                .strengths(texts(value, "strengths"))
                .gaps(texts(value, "gaps"))
                .recommendations(texts(value, "recommendations"))
                .build();
    }
}
