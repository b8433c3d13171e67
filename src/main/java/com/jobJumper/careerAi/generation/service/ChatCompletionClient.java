package com.jobJumper.careerAi.generation.service;

import com.jobJumper.careerAi.generation.dto.ChatCompletionRequest;
import com.jobJumper.careerAi.generation.dto.ChatCompletionResponse;
import com.jobJumper.careerAi.generation.dto.ChatTurn;
import com.jobJumper.careerAi.generation.exception.GenerationUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Client for OpenAI-compatible chat-completions endpoints.
 * Handles HTTP communication only; the returned text is normalized by the caller.
 */
@Slf4j
@Service
public class ChatCompletionClient implements GenerativeTextClient {

    private final RestClient restClient;
    private final String apiKey;
    private final String model;
    private final Double temperature;
    private final Integer maxCompletionTokens;

    public ChatCompletionClient(
            RestClient.Builder restClientBuilder,
            @Value("${llm.api.url:https://api.groq.com/openai/v1/chat/completions}") String apiUrl,
            @Value("${llm.api.key:}") String apiKey,
            @Value("${llm.api.model:llama-3.3-70b-versatile}") String model,
            @Value("${llm.api.temperature:0.3}") Double temperature,
            @Value("${llm.api.max-completion-tokens:4096}") Integer maxCompletionTokens) {
        this.restClient = restClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxCompletionTokens = maxCompletionTokens;
    }

    @Override
    public String converse(String systemPrompt, List<ChatTurn> history, String userMessage) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new GenerationUnavailableException("Model API key is not configured. Set llm.api.key in application.yaml");
        }

        List<ChatCompletionRequest.Message> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ChatCompletionRequest.Message.builder()
                    .role("system")
                    .content(systemPrompt)
                    .build());
        }
        if (history != null) {
            for (ChatTurn turn : history) {
                if (turn == null || turn.getText() == null || turn.getText().isBlank()) {
                    continue;
                }
                messages.add(ChatCompletionRequest.Message.builder()
                        .role(turn.isFromModel() ? "assistant" : "user")
                        .content(turn.getText())
                        .build());
            }
        }
        messages.add(ChatCompletionRequest.Message.builder()
                .role("user")
                .content(userMessage)
                .build());

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .messages(messages)
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .stream(false)
                .build();

        ChatCompletionResponse response;
        try {
            log.debug("Calling model API - model: {}, messages: {}, prompt length: {}",
                    model, messages.size(), userMessage != null ? userMessage.length() : 0);

            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientException e) {
            log.error("Error calling model API - model: {}", model, e);
            throw new GenerationUnavailableException("Failed to call model API: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new GenerationUnavailableException("Model API returned an empty HTTP body");
        }

        log.debug("Model API response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");

        String content = response.getContent();
        return content != null ? content : "";
    }
}
