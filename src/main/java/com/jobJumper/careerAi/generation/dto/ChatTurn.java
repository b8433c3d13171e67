package com.jobJumper.careerAi.generation.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One earlier message of a chat conversation, as held by the client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurn {

    public static final String USER = "user";
    public static final String MODEL = "model";

    /**
     * "user" or "model"; "assistant" is accepted as an alias of "model".
     */
    private String role;

    private String text;

    @JsonIgnore
    public boolean isFromModel() {
        return MODEL.equalsIgnoreCase(role) || "assistant".equalsIgnoreCase(role);
    }
}
