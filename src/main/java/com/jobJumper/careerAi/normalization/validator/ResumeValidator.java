package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobJumper.careerAi.normalization.model.ResumeDocument;
import com.jobJumper.careerAi.normalization.service.DescriptionNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Strict validator for {@link ResumeDocument}.
 * Bullet descriptions and the skills list are flattened before validation.
 */
@Component
@RequiredArgsConstructor
public class ResumeValidator extends AbstractResponseValidator<ResumeDocument> {

    private final DescriptionNormalizer descriptionNormalizer;

    @Override
    public String getShapeName() {
        return "resume";
    }

    @Override
    public JsonNode normalize(JsonNode sanitized) {
        return descriptionNormalizer.normalizeSkills(descriptionNormalizer.normalizeDescriptions(sanitized));
    }

    @Override
    public ResumeDocument validate(JsonNode value) {
        return ResumeDocument.builder()
                .fullName(text(value, "fullName"))
                .email(text(value, "email"))
                .phone(text(value, "phone"))
                .linkedin(text(value, "linkedin"))
                .location(text(value, "location"))
                .jobTitle(text(value, "jobTitle"))
                .summary(text(value, "summary"))
                .skills(text(value, "skills"))
                .experience(elements(value, "experience", this::experience))
                .projects(elements(value, "projects", this::project))
                .education(elements(value, "education", this::education))
                .build();
    }

    private ResumeDocument.Experience experience(JsonNode element) {
        return ResumeDocument.Experience.builder()
                .id(text(element, "id"))
                .role(primaryText(element, "role"))
                .company(text(element, "company"))
                .startDate(text(element, "startDate"))
                .endDate(text(element, "endDate"))
                .description(text(element, "description"))
                .build();
    }

    private ResumeDocument.Project project(JsonNode element) {
        return ResumeDocument.Project.builder()
                .id(text(element, "id"))
                .name(primaryText(element, "name"))
                .technologies(text(element, "technologies"))
                .link(text(element, "link"))
                .description(text(element, "description"))
                .build();
    }

    private ResumeDocument.Education education(JsonNode element) {
        return ResumeDocument.Education.builder()
                .id(text(element, "id"))
                .degree(primaryText(element, "degree"))
                .school(text(element, "school"))
                .year(text(element, "year"))
                .build();
    }
}
