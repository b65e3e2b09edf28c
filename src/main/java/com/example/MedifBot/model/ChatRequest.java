package com.example.MedifBot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Incoming chat message.
 *
 * @param message        free text typed by the visitor
 * @param conversationId id returned by a previous call; null starts a new conversation
 * @param ip             client address forwarded by the front end, stored with the transcript
 */
public record ChatRequest(
        String message,
        @JsonProperty("conversation_id") String conversationId,
        String ip
) {

    public String resolveConversationId() {
        return conversationId == null || conversationId.isBlank()
                ? UUID.randomUUID().toString()
                : conversationId;
    }
}
