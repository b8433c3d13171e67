package com.jobJumper.careerAi.career.service;

import com.jobJumper.careerAi.generation.dto.ChatTurn;
import com.jobJumper.careerAi.generation.exception.GenerationUnavailableException;
import com.jobJumper.careerAi.generation.service.GenerativeTextClient;
import com.jobJumper.careerAi.normalization.exception.StructuralFailureException;
import com.jobJumper.careerAi.normalization.model.CompanyResearchReport;
import com.jobJumper.careerAi.normalization.model.DocumentKind;
import com.jobJumper.careerAi.normalization.model.GeneratedDocument;
import com.jobJumper.careerAi.normalization.model.InterviewPrepKit;
import com.jobJumper.careerAi.normalization.model.JobFitAnalysis;
import com.jobJumper.careerAi.normalization.model.MatchScoreReport;
import com.jobJumper.careerAi.normalization.model.OnStructuralFailure;
import com.jobJumper.careerAi.normalization.model.ResumeDocument;
import com.jobJumper.careerAi.normalization.service.ResponseNormalizationService;
import com.jobJumper.careerAi.normalization.validator.CompanyResearchValidator;
import com.jobJumper.careerAi.normalization.validator.InterviewPrepValidator;
import com.jobJumper.careerAi.normalization.validator.JobFitValidator;
import com.jobJumper.careerAi.normalization.validator.MatchScoreValidator;
import com.jobJumper.careerAi.normalization.validator.ResponseValidator;
import com.jobJumper.careerAi.normalization.validator.ResumeValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Feature handlers of the career dashboard.
 *
 * Each feature sends a caller-built prompt to the model and runs the answer through
 * the normalization pipeline with that feature's structural-failure policy:
 * - scoring, fit analysis, resume tailoring and documents propagate failures
 *   (a defaulted answer would be misleading)
 * - interview prep and company research substitute defaulted records
 *   (an empty panel is better than a broken one)
 * - the chat assistant substitutes a "say it again" reply
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CareerAssistantService {

    private final GenerativeTextClient generativeTextClient;
    private final ResponseNormalizationService normalizationService;
    private final MatchScoreValidator matchScoreValidator;
    private final JobFitValidator jobFitValidator;
    private final CompanyResearchValidator companyResearchValidator;
    private final InterviewPrepValidator interviewPrepValidator;
    private final ResumeValidator resumeValidator;

    @Value("${career.failure-policy.match-score:PROPAGATE}")
    private OnStructuralFailure matchScorePolicy = OnStructuralFailure.PROPAGATE;

    @Value("${career.failure-policy.job-fit:PROPAGATE}")
    private OnStructuralFailure jobFitPolicy = OnStructuralFailure.PROPAGATE;

    @Value("${career.failure-policy.company-research:SUBSTITUTE_DEFAULT}")
    private OnStructuralFailure companyResearchPolicy = OnStructuralFailure.SUBSTITUTE_DEFAULT;

    @Value("${career.failure-policy.interview-prep:SUBSTITUTE_DEFAULT}")
    private OnStructuralFailure interviewPrepPolicy = OnStructuralFailure.SUBSTITUTE_DEFAULT;

    @Value("${career.failure-policy.resume:PROPAGATE}")
    private OnStructuralFailure resumePolicy = OnStructuralFailure.PROPAGATE;

    @Value("${career.failure-policy.document:PROPAGATE}")
    private OnStructuralFailure documentPolicy = OnStructuralFailure.PROPAGATE;

    @Value("${career.failure-policy.chat:SUBSTITUTE_DEFAULT}")
    private OnStructuralFailure chatPolicy = OnStructuralFailure.SUBSTITUTE_DEFAULT;

    public MatchScoreReport scoreMatch(String systemPrompt, String prompt) {
        MatchScoreReport report = runStructured(systemPrompt, prompt, matchScoreValidator, matchScorePolicy);
        log.info("Match score completed - score: {}, strengths: {}, gaps: {}",
                report.getScore(), report.getStrengths().size(), report.getGaps().size());
        return report;
    }

    public JobFitAnalysis analyzeJobFit(String systemPrompt, String prompt) {
        JobFitAnalysis analysis = runStructured(systemPrompt, prompt, jobFitValidator, jobFitPolicy);
        log.info("Job fit analysis completed - overallScore: {}, redFlags: {}",
                analysis.getMatchAnalysis().getOverallScore(), analysis.getRedFlags().size());
        return analysis;
    }

    public CompanyResearchReport researchCompany(String systemPrompt, String prompt) {
        CompanyResearchReport report = runStructured(systemPrompt, prompt, companyResearchValidator, companyResearchPolicy);
        log.info("Company research completed - sources: {}", report.getSources().size());
        return report;
    }

    public InterviewPrepKit prepareInterview(String systemPrompt, String prompt) {
        InterviewPrepKit kit = runStructured(systemPrompt, prompt, interviewPrepValidator, interviewPrepPolicy);
        log.info("Interview prep completed - technical questions: {}, behavioral questions: {}",
                kit.getTechnical().getQuestions().size(), kit.getBehavioral().size());
        return kit;
    }

    /**
     * Rewrites a full resume. The model is expected to keep every id field.
     */
    public ResumeDocument enhanceResume(String systemPrompt, String prompt) {
        ResumeDocument resume = runStructured(systemPrompt, prompt, resumeValidator, resumePolicy);
        log.info("Resume enhancement completed - experience: {}, projects: {}",
                resume.getExperience().size(), resume.getProjects().size());
        return resume;
    }

    /**
     * Extracts a resume from text the model was given (e.g. OCR of an uploaded file).
     */
    public ResumeDocument parseResume(String systemPrompt, String prompt) {
        ResumeDocument resume = runStructured(systemPrompt, prompt, resumeValidator, resumePolicy);
        log.info("Resume parsing completed - experience: {}, education: {}",
                resume.getExperience().size(), resume.getEducation().size());
        return resume;
    }

    public GeneratedDocument generateDocument(DocumentKind kind, String systemPrompt, String prompt) {
        String rawText = generativeTextClient.generate(systemPrompt, prompt);
        GeneratedDocument document = normalizationService.normalizeDocument(rawText, kind, documentPolicy);
        log.info("Document generated - kind: {}, length: {}", kind, document.getContent().length());
        return document;
    }

    /**
     * Answers one chat message in the context of the earlier turns.
     */
    public GeneratedDocument chat(String systemPrompt, List<ChatTurn> history, String message) {
        String rawText = generativeTextClient.converse(systemPrompt, history, message);
        GeneratedDocument reply = normalizationService.normalizeDocument(rawText, DocumentKind.CHAT_REPLY, chatPolicy);
        log.info("Chat reply generated - history turns: {}, length: {}",
                history != null ? history.size() : 0, reply.getContent().length());
        return reply;
    }

    /**
     * Rewrites one resume section. Any failure returns the original text so the
     * editor never loses the user's content.
     */
    public GeneratedDocument enhanceResumeSection(String systemPrompt, String prompt, String originalText) {
        try {
            String rawText = generativeTextClient.generate(systemPrompt, prompt);
            return normalizationService.normalizeDocument(rawText, DocumentKind.RESUME_SECTION, OnStructuralFailure.PROPAGATE);
        } catch (StructuralFailureException | GenerationUnavailableException e) {
            log.warn("Resume section rewrite failed, keeping original text - error: {}", e.getMessage());
            return GeneratedDocument.builder()
                    .kind(DocumentKind.RESUME_SECTION)
                    .content(originalText != null ? originalText : "")
                    .build();
        }
    }

    private <T> T runStructured(String systemPrompt, String prompt, ResponseValidator<T> validator,
                                OnStructuralFailure policy) {
        log.debug("Running feature - shape: {}, policy: {}", validator.getShapeName(), policy);
        String rawText = generativeTextClient.generate(systemPrompt, prompt);
        return normalizationService.normalize(rawText, validator, policy);
    }
}
