package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobJumper.careerAi.normalization.model.Difficulty;
import com.jobJumper.careerAi.normalization.model.InterviewPrepKit;
import com.jobJumper.careerAi.normalization.model.SoftLabel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InterviewPrepValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InterviewPrepValidator validator = new InterviewPrepValidator();

    @Test
    void validate_shouldProduceDocumentedDefaults() {
        InterviewPrepKit expected = InterviewPrepKit.builder()
                .companyResearch(InterviewPrepKit.CompanyResearch.builder()
                        .overview("").culture("").interviewStyle("").recentNews(List.of())
                        .build())
                .technical(InterviewPrepKit.Technical.builder().topics(List.of()).questions(List.of()).build())
                .behavioral(List.of())
                .questionsToAsk(List.of())
                .build();

        assertThat(validator.validate(null)).isEqualTo(expected);
    }

    @Test
    void validate_shouldDefaultQuestionFieldsIndividually() throws Exception {
        InterviewPrepKit kit = validator.validate(objectMapper.readTree(
                "{\"technical\": {\"questions\": [{}]}, \"behavioral\": [{}]}"));

        assertThat(kit.getTechnical().getQuestions()).containsExactly(InterviewPrepKit.TechnicalQuestion.builder()
                .question("").answer("").difficulty(new SoftLabel<>(Difficulty.OTHER, "")).build());
        assertThat(kit.getBehavioral()).containsExactly(InterviewPrepKit.BehavioralQuestion.builder()
                .question("").tip("").build());
    }

    @Test
    void validate_shouldReadQuestionsAndDefaultMissingParts() throws Exception {
        InterviewPrepKit kit = validator.validate(objectMapper.readTree("{"
                + "\"companyResearch\": {\"overview\": \"B2B SaaS\"},"
                + "\"technical\": {\"topics\": [\"Caching\"], \"questions\": ["
                + "  {\"question\": \"Design a rate limiter\", \"answer\": \"Token bucket\", \"difficulty\": \"hard\"},"
                + "  \"Explain CAP\","
                + "  {\"question\": \"Reverse a list\", \"difficulty\": \" Easy \"},"
                + "  {\"question\": \"Shard a database\", \"difficulty\": \"brutal\"}]},"
                + "\"behavioral\": [{\"question\": \"Tell me about a conflict\", \"tip\": \"Use STAR\"}]"
                + "}"));

        assertThat(kit.getCompanyResearch().getOverview()).isEqualTo("B2B SaaS");
        assertThat(kit.getCompanyResearch().getRecentNews()).isEmpty();
        assertThat(kit.getTechnical().getTopics()).containsExactly("Caching");
        assertThat(kit.getTechnical().getQuestions()).hasSize(4);
        assertThat(kit.getTechnical().getQuestions().get(0).getDifficulty().getValue()).isEqualTo(Difficulty.HARD);
        assertThat(kit.getTechnical().getQuestions().get(0).getDifficulty().getLabel()).isEqualTo("hard");
        assertThat(kit.getTechnical().getQuestions().get(1).getDifficulty().getValue()).isEqualTo(Difficulty.OTHER);
        assertThat(kit.getTechnical().getQuestions().get(2).getDifficulty().getValue()).isEqualTo(Difficulty.EASY);
        assertThat(kit.getTechnical().getQuestions().get(2).getDifficulty().getLabel()).isEqualTo("Easy");
        assertThat(kit.getTechnical().getQuestions().get(3).getDifficulty().getValue()).isEqualTo(Difficulty.OTHER);
        assertThat(kit.getTechnical().getQuestions().get(3).getDifficulty().getLabel()).isEqualTo("brutal");
        assertThat(kit.getTechnical().getQuestions().get(1).getQuestion()).isEqualTo("Explain CAP");
        assertThat(kit.getTechnical().getQuestions().get(1).getAnswer()).isEmpty();
        assertThat(kit.getBehavioral().get(0).getTip()).isEqualTo("Use STAR");
        assertThat(kit.getQuestionsToAsk()).isEmpty();
    }

    @Test
    void fallback_shouldPutPlaceholderInOverview() {
        InterviewPrepKit kit = validator.fallback("Failed to generate.");

        assertThat(kit.getCompanyResearch().getOverview()).isEqualTo("Failed to generate.");
        assertThat(kit.getTechnical().getQuestions()).isEmpty();
        assertThat(kit.getBehavioral()).isEmpty();
    }
}
