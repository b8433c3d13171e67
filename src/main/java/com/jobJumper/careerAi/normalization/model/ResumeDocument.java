package com.jobJumper.careerAi.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Resume as returned by the enhancer or parsed from an uploaded resume.
 * Descriptions are newline-joined "• " bullets; skills are comma-separated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResumeDocument {

    private String fullName;
    private String email;
    private String phone;
    private String linkedin;
    private String location;
    private String jobTitle;
    private String summary;
    private String skills;

    private List<Experience> experience;

    private List<Project> projects;

    private List<Education> education;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Experience {
        private String id;
        private String role;
        private String company;
        private String startDate;
        private String endDate;
        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Project {
        private String id;
        private String name;
        private String technologies;
        private String link;
        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Education {
        private String id;
        private String degree;
        private String school;
        private String year;
    }
}
