package com.example.MedifBot.model;

import java.time.Instant;

/**
 * One stored message of a conversation, as read back for prompt history.
 */
public record ConversationTurn(
        String role,
        String content,
        Instant createdAt
) {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public boolean isAssistant() {
        return ASSISTANT.equals(role);
    }
}
