package com.example.MedifBot.controller;

import com.example.MedifBot.model.ChatMessage;
import com.example.MedifBot.model.ChatRequest;
import com.example.MedifBot.model.ChatResponse;
import com.example.MedifBot.service.ChatService;
import com.example.MedifBot.service.ConversationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;
    private final ConversationStore conversationStore;

    /**
     * Request:
     *   POST /api/chat
     *   { "message": "¿Qué cursos ofrecen?", "conversation_id": "...", "ip": "..." }
     * The response carries the conversation_id to send back on the next turn.
     */
    @PostMapping
    public Mono<ChatResponse> chat(@RequestBody ChatRequest request) {
        return chatService.chat(request);
    }

    /**
     * Full transcript of one conversation, oldest first.
     *   GET /api/chat/messages?conversation_id=xxx
     */
    @GetMapping("/messages")
    public List<ChatMessage> messages(@RequestParam("conversation_id") String conversationId) {
        return conversationStore.listMessages(conversationId);
    }
}
