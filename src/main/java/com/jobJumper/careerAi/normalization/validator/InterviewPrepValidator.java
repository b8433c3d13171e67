package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobJumper.careerAi.normalization.model.Difficulty;
import com.jobJumper.careerAi.normalization.model.InterviewPrepKit;
import org.springframework.stereotype.Component;

/**
 * Strict validator for {@link InterviewPrepKit}.
 */
@Component
public class InterviewPrepValidator extends AbstractResponseValidator<InterviewPrepKit> {

    @Override
    public String getShapeName() {
        return "interview-prep";
    }

    @Override
    public InterviewPrepKit validate(JsonNode value) {
        return InterviewPrepKit.builder()
                .companyResearch(companyResearch(object(value, "companyResearch")))
                .technical(technical(object(value, "technical")))
                .behavioral(elements(value, "behavioral", this::behavioralQuestion))
                .questionsToAsk(texts(value, "questionsToAsk"))
                .build();
    }

    /**
     * The overview panel carries the placeholder so the kit renders as
     * "failed" rather than silently empty.
     */
    @Override
    public InterviewPrepKit fallback(String placeholder) {
        InterviewPrepKit kit = validate(null);
        kit.getCompanyResearch().setOverview(placeholder);
        return kit;
    }

    private InterviewPrepKit.CompanyResearch companyResearch(JsonNode node) {
        return InterviewPrepKit.CompanyResearch.builder()
                .overview(text(node, "overview"))
                .culture(text(node, "culture"))
                .interviewStyle(text(node, "interviewStyle"))
                .recentNews(texts(node, "recentNews"))
                .build();
    }

    private InterviewPrepKit.Technical technical(JsonNode node) {
        return InterviewPrepKit.Technical.builder()
                .topics(texts(node, "topics"))
                .questions(elements(node, "questions", this::technicalQuestion))
                .build();
    }

    private InterviewPrepKit.TechnicalQuestion technicalQuestion(JsonNode element) {
        return InterviewPrepKit.TechnicalQuestion.builder()
                .question(primaryText(element, "question"))
                .answer(text(element, "answer"))
                .difficulty(label(element, "difficulty", Difficulty.class))
                .build();
    }

    private InterviewPrepKit.BehavioralQuestion behavioralQuestion(JsonNode element) {
        return InterviewPrepKit.BehavioralQuestion.builder()
                .question(primaryText(element, "question"))
                .tip(text(element, "tip"))
                .build();
    }
}
