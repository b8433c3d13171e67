package com.jobJumper.careerAi.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Company research report used before applying or interviewing.
 *
 * Employee voices are capped at 5, review quotes at 10 and sources at 5.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompanyResearchReport {

    private String summary;

    private CompanyIntelligence companyIntelligence;

    private MarketAnalysis marketAnalysis;

    private Culture culture;

    private Compensation compensation;

    private Hiring hiring;

    private Risks risks;

    private Strategy strategy;

    private Reviews reviews;

    private List<Source> sources;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CompanyIntelligence {
        private String overview;
        private String industry;
        private String size;
        private String founded;
        private String headquarters;
        private List<String> recentNews;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class MarketAnalysis {
        private String position;
        private List<String> competitors;
        private List<String> trends;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Culture {
        private List<String> values;
        private String workEnvironment;
        private List<EmployeeVoice> employeeVoices;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class EmployeeVoice {
        private String quote;
        private String role;
        private SoftLabel<Sentiment> sentiment;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Compensation {
        private String salaryRange;
        private List<String> benefits;
        private String equity;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Hiring {
        private List<String> process;
        private String timeline;
        private List<String> tips;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Risks {
        private SoftLabel<RiskLevel> level;
        private List<String> factors;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Strategy {
        private String positioning;
        private List<String> talkingPoints;
        private List<String> questionsToAsk;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Reviews {
        private double overallRating;
        private List<String> pros;
        private List<String> cons;
        private List<String> quotes;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Source {
        private String title;
        private String url;
    }
}
