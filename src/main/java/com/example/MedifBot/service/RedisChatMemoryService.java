package com.example.MedifBot.service;

import com.example.MedifBot.config.ChatbotProperties;
import com.example.MedifBot.model.ConversationTurn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling window of the latest messages per conversation, kept in a Redis list.
 * The durable transcript lives in the database; this is only a fast read path for prompt history.
 */
@Service
@RequiredArgsConstructor
public class RedisChatMemoryService {

    private static final Logger log = LoggerFactory.getLogger(RedisChatMemoryService.class);

    private static final String KEY_PREFIX = "chat:memory:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ChatbotProperties properties;

    /**
     * Latest {@code limit} messages, oldest first. Empty when the window does not exist.
     */
    public List<ConversationTurn> loadRecent(String conversationId, int limit) {
        String key = buildKey(conversationId);
        Long size = redisTemplate.opsForList().size(key);
        if (size == null || size == 0L) {
            return List.of();
        }

        long start = Math.max(0, size - limit);
        List<String> rawMessages = redisTemplate.opsForList().range(key, start, size - 1);
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<ConversationTurn> turns = new ArrayList<>();
        for (String raw : rawMessages) {
            try {
                StoredMessage message = objectMapper.readValue(raw, StoredMessage.class);
                turns.add(new ConversationTurn(message.role(), message.content(), Instant.ofEpochMilli(message.timestamp())));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed chat memory entry for conv={}", conversationId);
            }
        }
        return turns;
    }

    /**
     * Append one message, trim the list to the configured window and refresh the rolling TTL.
     *
     * @throws IllegalStateException if the message cannot be serialized
     */
    public void append(String conversationId, String role, String content) {
        String key = buildKey(conversationId);
        StoredMessage message = new StoredMessage(role, content, Instant.now().toEpochMilli());
        try {
            redisTemplate.opsForList().rightPush(key, objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize chat memory entry", e);
        }

        int window = properties.getHistory().getRedisWindow();
        Long size = redisTemplate.opsForList().size(key);
        if (size != null && size > window) {
            redisTemplate.opsForList().trim(key, size - window, size - 1);
        }
        redisTemplate.expire(key, properties.getHistory().getTtl());
    }

    /** Drop the window so the next read rebuilds history from the database. */
    public void evict(String conversationId) {
        redisTemplate.delete(buildKey(conversationId));
    }

    private String buildKey(String conversationId) {
        return KEY_PREFIX + conversationId;
    }

    public record StoredMessage(String role, String content, long timestamp) { }
}
