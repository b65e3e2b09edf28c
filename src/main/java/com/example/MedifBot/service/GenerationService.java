package com.example.MedifBot.service;

import com.example.MedifBot.config.ChatbotProperties;
import com.example.MedifBot.exception.GenerationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Single-shot text generation against the configured chat model. No retries here;
 * timeouts and retries belong to the Spring AI client configuration.
 */
@Service
@RequiredArgsConstructor
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    public static final String DEFAULT_MODEL = "deepseek";

    private final Map<String, ChatClient> chatClients;
    private final ChatbotProperties properties;

    /**
     * @throws GenerationException if the model call fails or returns blank text
     */
    public String generate(String prompt, double temperature, double topP) {
        String model = properties.getGeneration().getModel();
        ChatClient chatClient = resolveClient(model);

        ChatOptions options = ChatOptions.builder()
                .temperature(temperature)
                .topP(topP)
                .build();

        String content;
        try {
            content = chatClient.prompt()
                    .user(prompt)
                    .options(options)
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            throw new GenerationException("Chat model '" + model + "' call failed: " + ex.getMessage(), ex);
        }

        if (content == null || content.isBlank()) {
            log.warn("Chat model '{}' replied without text (prompt {} chars)", model, prompt.length());
            throw new GenerationException("Chat model '" + model + "' replied without text");
        }
        return content.strip();
    }

    /**
     * Resolve ChatClient bean by model name.
     * Lookup keys: "<model>ChatClient", then "<model>".
     * Fallback: the default model's client, then any client.
     */
    ChatClient resolveClient(String model) {
        String key = Optional.ofNullable(model)
                .map(m -> m.toLowerCase(Locale.ROOT))
                .orElse(DEFAULT_MODEL);
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        ChatClient fallback = chatClients.get(DEFAULT_MODEL + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new GenerationException("No ChatClient beans are available"));
    }
}
