package com.jobJumper.careerAi.career.controller;

import com.jobJumper.careerAi.career.service.CareerAssistantService;
import com.jobJumper.careerAi.generation.dto.ChatTurn;
import com.jobJumper.careerAi.generation.exception.GenerationUnavailableException;
import com.jobJumper.careerAi.normalization.exception.StructuralFailureException;
import com.jobJumper.careerAi.normalization.model.DocumentKind;
import com.jobJumper.careerAi.normalization.model.GeneratedDocument;
import com.jobJumper.careerAi.normalization.model.MatchScoreReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CareerController.class)
class CareerControllerTest {

    private static final String BODY = "{\"systemPrompt\": \"You are a recruiter\", \"prompt\": \"Score me\"}";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CareerAssistantService careerAssistantService;

    @Test
    void matchScore_shouldReturnReport() throws Exception {
        when(careerAssistantService.scoreMatch("You are a recruiter", "Score me")).thenReturn(MatchScoreReport.builder()
                .score(81)
                .summary("Strong")
                .strengths(List.of("Java"))
                .gaps(List.of())
                .recommendations(List.of())
                .build());

        mvc.perform(post("/api/v1/career/match-score").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(81))
                .andExpect(jsonPath("$.strengths[0]").value("Java"));
    }

    @Test
    void matchScore_shouldRejectBlankPrompt() throws Exception {
        mvc.perform(post("/api/v1/career/match-score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(careerAssistantService);
    }

    @Test
    void jobFit_shouldMapStructuralFailureToBadGateway() throws Exception {
        when(careerAssistantService.analyzeJobFit(anyString(), anyString()))
                .thenThrow(new StructuralFailureException("job-fit", "no object"));

        mvc.perform(post("/api/v1/career/job-fit").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("GENERATION_FAILED"))
                .andExpect(jsonPath("$.message").value("The operation failed, please try again."));
    }

    @Test
    void coverLetter_shouldMapUnavailableModelToServiceUnavailable() throws Exception {
        when(careerAssistantService.generateDocument(any(DocumentKind.class), anyString(), anyString()))
                .thenThrow(new GenerationUnavailableException("down"));

        mvc.perform(post("/api/v1/career/cover-letter").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("MODEL_UNAVAILABLE"));
    }

    @Test
    void negotiationStrategy_shouldPassDocumentKind() throws Exception {
        when(careerAssistantService.generateDocument(DocumentKind.NEGOTIATION_STRATEGY, "You are a recruiter", "Score me"))
                .thenReturn(GeneratedDocument.builder()
                        .kind(DocumentKind.NEGOTIATION_STRATEGY)
                        .content("Anchor high")
                        .build());

        mvc.perform(post("/api/v1/career/negotiation-strategy").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("NEGOTIATION_STRATEGY"))
                .andExpect(jsonPath("$.content").value("Anchor high"));
    }

    @Test
    void resumeSection_shouldPassOriginalText() throws Exception {
        when(careerAssistantService.enhanceResumeSection("sys", "Rewrite", "Led a team"))
                .thenReturn(GeneratedDocument.builder()
                        .kind(DocumentKind.RESUME_SECTION)
                        .content("Led a team of four")
                        .build());

        mvc.perform(post("/api/v1/career/resume/section")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"systemPrompt\": \"sys\", \"prompt\": \"Rewrite\", \"originalText\": \"Led a team\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("Led a team of four"));
    }

    @Test
    void interviewPrep_shouldRejectMalformedBody() throws Exception {
        mvc.perform(post("/api/v1/career/interview-prep").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void chat_shouldPassHistoryAndReturnReply() throws Exception {
        when(careerAssistantService.chat(eq("coach"), eq(List.of(new ChatTurn("user", "Hi"), new ChatTurn("model", "Hello!"))),
                eq("Any tips?")))
                .thenReturn(GeneratedDocument.builder()
                        .kind(DocumentKind.CHAT_REPLY)
                        .content("Follow up after interviews")
                        .build());

        mvc.perform(post("/api/v1/career/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"systemPrompt\": \"coach\", \"message\": \"Any tips?\","
                                + " \"history\": [{\"role\": \"user\", \"text\": \"Hi\"}, {\"role\": \"model\", \"text\": \"Hello!\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("CHAT_REPLY"))
                .andExpect(jsonPath("$.content").value("Follow up after interviews"));
    }

    @Test
    void chat_shouldRejectBlankMessage() throws Exception {
        mvc.perform(post("/api/v1/career/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(careerAssistantService);
    }
}
