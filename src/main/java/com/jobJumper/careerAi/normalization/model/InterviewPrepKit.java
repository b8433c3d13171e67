package com.jobJumper.careerAi.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Interview preparation kit for one application.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterviewPrepKit {

    private CompanyResearch companyResearch;

    private Technical technical;

    private List<BehavioralQuestion> behavioral;

    private List<String> questionsToAsk;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CompanyResearch {
        private String overview;
        private String culture;
        private String interviewStyle;
        private List<String> recentNews;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Technical {
        private List<String> topics;
        private List<TechnicalQuestion> questions;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class TechnicalQuestion {
        private String question;
        private String answer;
        private SoftLabel<Difficulty> difficulty;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class BehavioralQuestion {
        private String question;
        private String tip;
    }
}
