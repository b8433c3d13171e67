package com.jobJumper.careerAi.generation.service;

import com.jobJumper.careerAi.generation.dto.ChatTurn;
import com.jobJumper.careerAi.generation.exception.GenerationUnavailableException;

import java.util.List;

/**
 * Source of raw model text for the feature handlers.
 */
public interface GenerativeTextClient {

    /**
     * Sends one prompt and returns the model's raw text.
     *
     * @param systemPrompt System instruction, may be null
     * @param userPrompt User prompt
     * @return Raw model text; "" when the model returned no text
     * @throws GenerationUnavailableException on transport or API failure
     */
    default String generate(String systemPrompt, String userPrompt) {
        return converse(systemPrompt, List.of(), userPrompt);
    }

    /**
     * Continues a conversation: earlier turns are sent in order before the new message.
     *
     * @param systemPrompt System instruction, may be null
     * @param history Earlier turns, oldest first; may be null or empty
     * @param userMessage New user message
     * @return Raw model text; "" when the model returned no text
     * @throws GenerationUnavailableException on transport or API failure
     */
    String converse(String systemPrompt, List<ChatTurn> history, String userMessage);
}
