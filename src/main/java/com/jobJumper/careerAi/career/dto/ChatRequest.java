package com.jobJumper.careerAi.career.dto;

import com.jobJumper.careerAi.generation.dto.ChatTurn;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for the chat assistant.
 * The client keeps the conversation and sends the earlier turns with every message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    private String systemPrompt;

    /**
     * Earlier turns, oldest first.
     */
    private List<ChatTurn> history = new ArrayList<>();

    @NotBlank(message = "message cannot be blank")
    private String message;
}
