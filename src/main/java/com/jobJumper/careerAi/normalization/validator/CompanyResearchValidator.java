package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobJumper.careerAi.normalization.model.CompanyResearchReport;
import com.jobJumper.careerAi.normalization.model.RiskLevel;
import com.jobJumper.careerAi.normalization.model.Sentiment;
import org.springframework.stereotype.Component;

/**
 * Strict validator for {@link CompanyResearchReport}.
 *
 * Enrichment lists are capped to bound rendering cost; extra elements are dropped
 * silently, keeping the first ones in model order.
 */
@Component
public class CompanyResearchValidator extends AbstractResponseValidator<CompanyResearchReport> {

    static final int MAX_EMPLOYEE_VOICES = 5;
    static final int MAX_REVIEW_QUOTES = 10;
    static final int MAX_SOURCES = 5;

    @Override
    public String getShapeName() {
        return "company-research";
    }

    @Override
    public CompanyResearchReport validate(JsonNode value) {
        return CompanyResearchReport.builder()
                .summary(text(value, "summary"))
                .companyIntelligence(companyIntelligence(object(value, "companyIntelligence")))
                .marketAnalysis(marketAnalysis(object(value, "marketAnalysis")))
                .culture(culture(object(value, "culture")))
                .compensation(compensation(object(value, "compensation")))
                .hiring(hiring(object(value, "hiring")))
                .risks(risks(object(value, "risks")))
                .strategy(strategy(object(value, "strategy")))
                .reviews(reviews(object(value, "reviews")))
                .sources(elements(value, "sources", this::source, MAX_SOURCES))
                .build();
    }

    @Override
    public CompanyResearchReport fallback(String placeholder) {
        CompanyResearchReport report = validate(null);
        report.setSummary(placeholder);
        return report;
    }

    private CompanyResearchReport.CompanyIntelligence companyIntelligence(JsonNode node) {
        return CompanyResearchReport.CompanyIntelligence.builder()
                .overview(text(node, "overview"))
                .industry(text(node, "industry"))
                .size(text(node, "size"))
                .founded(text(node, "founded"))
                .headquarters(text(node, "headquarters"))
                .recentNews(texts(node, "recentNews"))
                .build();
    }

    private CompanyResearchReport.MarketAnalysis marketAnalysis(JsonNode node) {
        return CompanyResearchReport.MarketAnalysis.builder()
                .position(text(node, "position"))
                .competitors(texts(node, "competitors"))
                .trends(texts(node, "trends"))
                .build();
    }

    private CompanyResearchReport.Culture culture(JsonNode node) {
        return CompanyResearchReport.Culture.builder()
                .values(texts(node, "values"))
                .workEnvironment(text(node, "workEnvironment"))
                .employeeVoices(elements(node, "employeeVoices", this::employeeVoice, MAX_EMPLOYEE_VOICES))
                .build();
    }

    private CompanyResearchReport.EmployeeVoice employeeVoice(JsonNode element) {
        return CompanyResearchReport.EmployeeVoice.builder()
                .quote(primaryText(element, "quote"))
                .role(text(element, "role"))
                .sentiment(label(element, "sentiment", Sentiment.class))
                .build();
    }

    private CompanyResearchReport.Compensation compensation(JsonNode node) {
        return CompanyResearchReport.Compensation.builder()
                .salaryRange(text(node, "salaryRange"))
                .benefits(texts(node, "benefits"))
                .equity(text(node, "equity"))
                .build();
    }

    private CompanyResearchReport.Hiring hiring(JsonNode node) {
        return CompanyResearchReport.Hiring.builder()
                .process(texts(node, "process"))
                .timeline(text(node, "timeline"))
                .tips(texts(node, "tips"))
                .build();
    }

    private CompanyResearchReport.Risks risks(JsonNode node) {
        return CompanyResearchReport.Risks.builder()
                .level(label(node, "level", RiskLevel.class))
                .factors(texts(node, "factors"))
                .build();
    }

    private CompanyResearchReport.Strategy strategy(JsonNode node) {
        return CompanyResearchReport.Strategy.builder()
                .positioning(text(node, "positioning"))
                .talkingPoints(texts(node, "talkingPoints"))
                .questionsToAsk(texts(node, "questionsToAsk"))
                .build();
    }

    private CompanyResearchReport.Reviews reviews(JsonNode node) {
        return CompanyResearchReport.Reviews.builder()
                .overallRating(decimal(node, "overallRating"))
                .pros(texts(node, "pros"))
                .cons(texts(node, "cons"))
                .quotes(texts(node, "quotes", MAX_REVIEW_QUOTES))
                .build();
    }

    private CompanyResearchReport.Source source(JsonNode element) {
        return CompanyResearchReport.Source.builder()
                .title(primaryText(element, "title"))
                .url(text(element, "url"))
                .build();
    }
}
