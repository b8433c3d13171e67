package com.jobJumper.careerAi.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Job-fit analysis of a posting against the candidate's profile.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobFitAnalysis {

    private KeyInfo keyInfo;

    private Skills skills;

    private MatchAnalysis matchAnalysis;

    private List<RedFlag> redFlags;

    private CompetitiveAnalysis competitiveAnalysis;

    private Recommendation recommendation;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class KeyInfo {
        private String title;
        private String company;
        private String location;
        private String salaryRange;
        private String experienceLevel;
        private String employmentType;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Skills {
        private List<SkillMatch> technical;
        private List<SkillMatch> soft;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SkillMatch {
        private String name;
        private SkillStatus status;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class MatchAnalysis {
        private int overallScore;
        private int skillsScore;
        private int experienceScore;
        private String summary;
        private List<String> strengths;
        private List<String> gaps;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class RedFlag {
        private String flag;
        private SoftLabel<RiskLevel> severity;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CompetitiveAnalysis {
        private String marketPosition;
        private List<String> advantages;
        private List<String> disadvantages;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Recommendation {
        /**
         * Free-form verdict such as "Apply" or "Skip".
         */
        private String decision;
        private SoftLabel<PriorityLevel> priority;
        private String reasoning;
        private List<String> nextSteps;
    }
}
