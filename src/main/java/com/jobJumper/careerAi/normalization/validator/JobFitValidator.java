package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobJumper.careerAi.normalization.model.JobFitAnalysis;
import com.jobJumper.careerAi.normalization.model.PriorityLevel;
import com.jobJumper.careerAi.normalization.model.RiskLevel;
import com.jobJumper.careerAi.normalization.model.SkillStatus;
import org.springframework.stereotype.Component;

/**
 * Strict validator for {@link JobFitAnalysis}.
 *
 * Skill elements are validated one by one; a status other than "matched"
 * becomes {@link SkillStatus#MISSING}.
 */
@Component
public class JobFitValidator extends AbstractResponseValidator<JobFitAnalysis> {

    @Override
    public String getShapeName() {
        return "job-fit";
    }

    @Override
    public JobFitAnalysis validate(JsonNode value) {
        return JobFitAnalysis.builder()
                .keyInfo(keyInfo(object(value, "keyInfo")))
                .skills(skills(object(value, "skills")))
                .matchAnalysis(matchAnalysis(object(value, "matchAnalysis")))
                .redFlags(elements(value, "redFlags", this::redFlag))
                .competitiveAnalysis(competitiveAnalysis(object(value, "competitiveAnalysis")))
                .recommendation(recommendation(object(value, "recommendation")))
                .build();
    }

    private JobFitAnalysis.KeyInfo keyInfo(JsonNode node) {
        return JobFitAnalysis.KeyInfo.builder()
                .title(text(node, "title"))
                .company(text(node, "company"))
                .location(text(node, "location"))
                .salaryRange(text(node, "salaryRange"))
                .experienceLevel(text(node, "experienceLevel"))
                .employmentType(text(node, "employmentType"))
                .build();
    }

    private JobFitAnalysis.Skills skills(JsonNode node) {
        return JobFitAnalysis.Skills.builder()
                .technical(elements(node, "technical", this::skillMatch))
                .soft(elements(node, "soft", this::skillMatch))
                .build();
    }

    JobFitAnalysis.SkillMatch skillMatch(JsonNode element) {
        return JobFitAnalysis.SkillMatch.builder()
                .name(primaryText(element, "name"))
                .status(SkillStatus.fromLiteral(text(element, "status")))
                .build();
    }

    private JobFitAnalysis.MatchAnalysis matchAnalysis(JsonNode node) {
        return JobFitAnalysis.MatchAnalysis.builder()
                .overallScore(wholeNumber(node, "overallScore"))
                .skillsScore(wholeNumber(node, "skillsScore"))
                .experienceScore(wholeNumber(node, "experienceScore"))
                .summary(text(node, "summary"))
                .strengths(texts(node, "strengths"))
                .gaps(texts(node, "gaps"))
                .build();
    }

    private JobFitAnalysis.RedFlag redFlag(JsonNode element) {
        return JobFitAnalysis.RedFlag.builder()
                .flag(primaryText(element, "flag"))
                .severity(label(element, "severity", RiskLevel.class))
                .build();
    }

    private JobFitAnalysis.CompetitiveAnalysis competitiveAnalysis(JsonNode node) {
        return JobFitAnalysis.CompetitiveAnalysis.builder()
                .marketPosition(text(node, "marketPosition"))
                .advantages(texts(node, "advantages"))
                .disadvantages(texts(node, "disadvantages"))
                .build();
    }

    private JobFitAnalysis.Recommendation recommendation(JsonNode node) {
        return JobFitAnalysis.Recommendation.builder()
                .decision(text(node, "decision"))
                .priority(label(node, "priority", PriorityLevel.class))
                .reasoning(text(node, "reasoning"))
                .nextSteps(texts(node, "nextSteps"))
                .build();
    }
}
