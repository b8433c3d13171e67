package com.jobJumper.careerAi.career.controller;

import com.jobJumper.careerAi.career.dto.ChatRequest;
import com.jobJumper.careerAi.career.dto.FeatureRequest;
import com.jobJumper.careerAi.career.dto.ResumeSectionRequest;
import com.jobJumper.careerAi.career.service.CareerAssistantService;
import com.jobJumper.careerAi.normalization.model.CompanyResearchReport;
import com.jobJumper.careerAi.normalization.model.DocumentKind;
import com.jobJumper.careerAi.normalization.model.GeneratedDocument;
import com.jobJumper.careerAi.normalization.model.InterviewPrepKit;
import com.jobJumper.careerAi.normalization.model.JobFitAnalysis;
import com.jobJumper.careerAi.normalization.model.MatchScoreReport;
import com.jobJumper.careerAi.normalization.model.ResumeDocument;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Career feature REST controller - thin HTTP layer over {@link CareerAssistantService}.
 */
@RestController
@RequestMapping("/api/v1/career")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class CareerController {

    private final CareerAssistantService careerAssistantService;

    @PostMapping("/match-score")
    public ResponseEntity<MatchScoreReport> matchScore(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.scoreMatch(request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/job-fit")
    public ResponseEntity<JobFitAnalysis> jobFit(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.analyzeJobFit(request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/company-research")
    public ResponseEntity<CompanyResearchReport> companyResearch(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.researchCompany(request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/interview-prep")
    public ResponseEntity<InterviewPrepKit> interviewPrep(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.prepareInterview(request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/resume/enhance")
    public ResponseEntity<ResumeDocument> enhanceResume(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.enhanceResume(request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/resume/parse")
    public ResponseEntity<ResumeDocument> parseResume(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.parseResume(request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/resume/section")
    public ResponseEntity<GeneratedDocument> enhanceResumeSection(@Valid @RequestBody ResumeSectionRequest request) {
        return ResponseEntity.ok(careerAssistantService.enhanceResumeSection(
                request.getSystemPrompt(), request.getPrompt(), request.getOriginalText()));
    }

    @PostMapping("/cover-letter")
    public ResponseEntity<GeneratedDocument> coverLetter(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.generateDocument(
                DocumentKind.COVER_LETTER, request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/interview-guide")
    public ResponseEntity<GeneratedDocument> interviewGuide(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.generateDocument(
                DocumentKind.INTERVIEW_GUIDE, request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/negotiation-strategy")
    public ResponseEntity<GeneratedDocument> negotiationStrategy(@Valid @RequestBody FeatureRequest request) {
        return ResponseEntity.ok(careerAssistantService.generateDocument(
                DocumentKind.NEGOTIATION_STRATEGY, request.getSystemPrompt(), request.getPrompt()));
    }

    @PostMapping("/chat")
    public ResponseEntity<GeneratedDocument> chat(@Valid @RequestBody ChatRequest request) {
        return ResponseEntity.ok(careerAssistantService.chat(
                request.getSystemPrompt(), request.getHistory(), request.getMessage()));
    }
}
