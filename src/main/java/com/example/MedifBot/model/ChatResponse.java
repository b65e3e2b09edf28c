package com.example.MedifBot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatResponse(
        String response,
        @JsonProperty("conversation_id") String conversationId
) {
}
