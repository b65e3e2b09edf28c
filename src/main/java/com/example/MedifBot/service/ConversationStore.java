package com.example.MedifBot.service;

import com.example.MedifBot.model.ChatMessage;
import com.example.MedifBot.model.Conversation;
import com.example.MedifBot.model.ConversationTurn;
import com.example.MedifBot.model.PersistOutcome;
import com.example.MedifBot.repository.ChatMessageRepository;
import com.example.MedifBot.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversation transcript access for the chat pipeline.
 * Reads prefer the Redis window and fall back to the database; writes go to the database
 * first, then to Redis. Nothing here throws: failures are logged and reported as values.
 */
@Service
@RequiredArgsConstructor
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    private final ChatMessageRepository chatMessageRepository;
    private final ConversationRepository conversationRepository;
    private final RedisChatMemoryService chatMemoryService;

    /** Most recent {@code limit} turns, oldest first. Empty on any storage failure. */
    public List<ConversationTurn> getRecent(String conversationId, int limit) {
        try {
            List<ConversationTurn> cached = chatMemoryService.loadRecent(conversationId, limit);
            if (!cached.isEmpty()) {
                return cached;
            }
        } catch (RuntimeException e) {
            log.warn("Redis history unavailable for conv={}: {}", conversationId, e.getMessage());
        }

        try {
            List<ChatMessage> newestFirst = chatMessageRepository
                    .findByConversationIdOrderByCreatedAtDesc(conversationId, PageRequest.of(0, limit));
            List<ConversationTurn> turns = new ArrayList<>(newestFirst.size());
            for (ChatMessage message : newestFirst) {
                turns.add(message.toTurn());
            }
            Collections.reverse(turns);
            return turns;
        } catch (RuntimeException e) {
            log.error("Error loading history for conv={}", conversationId, e);
            return List.of();
        }
    }

    public PersistOutcome saveTurn(String conversationId, String role, String content, String ip) {
        ChatMessage message = new ChatMessage();
        message.setConversationId(conversationId);
        message.setRole(role);
        message.setContent(content);
        message.setIp(ip);
        try {
            chatMessageRepository.save(message);
            log.debug("Saved message conv={}, role={}, len={}", conversationId, role, content.length());
        } catch (RuntimeException e) {
            log.error("Failed to save {} message for conv={}", role, conversationId, e);
            return PersistOutcome.failed(e);
        }

        try {
            chatMemoryService.append(conversationId, role, content);
        } catch (RuntimeException e) {
            log.warn("Redis history not updated for conv={}: {}", conversationId, e.getMessage());
            evictWindow(conversationId);
        }
        return PersistOutcome.ok();
    }

    // A window missing a turn must not be served again; without it reads fall back to the database.
    private void evictWindow(String conversationId) {
        try {
            chatMemoryService.evict(conversationId);
        } catch (RuntimeException e) {
            log.error("Stale Redis history could not be dropped for conv={}", conversationId, e);
        }
    }

    /** Register the conversation id once; later calls are no-ops. */
    public void ensureConversation(String conversationId) {
        try {
            if (!conversationRepository.existsById(conversationId)) {
                Conversation conversation = new Conversation();
                conversation.setConversationId(conversationId);
                conversationRepository.save(conversation);
            }
        } catch (RuntimeException e) {
            log.error("Failed to register conversation metadata for conv={}", conversationId, e);
        }
    }

    /** Full transcript, oldest first. */
    public List<ChatMessage> listMessages(String conversationId) {
        return chatMessageRepository.findByConversationIdOrderByCreatedAtAsc(conversationId);
    }
}
