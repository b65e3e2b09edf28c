package com.example.MedifBot.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reachability probe for the embedding and chat models, used by the health endpoint.
 */
@Service
@RequiredArgsConstructor
public class ModelHealthService {

    private static final Logger log = LoggerFactory.getLogger(ModelHealthService.class);

    private final EmbeddingModel embeddingModel;
    private final GenerationService generationService;

    public Map<String, Object> check() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("embedding", probe("embedding", () -> embeddingModel.embed("ping")));
        health.put("chat", probe("chat", () -> generationService.generate("ping", 0.0, 1.0)));
        return health;
    }

    private Map<String, Object> probe(String name, Runnable call) {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            call.run();
            result.put("ok", true);
            result.put("detail", "ok");
        } catch (RuntimeException e) {
            log.warn("Health probe '{}' failed: {}", name, e.getMessage());
            result.put("ok", false);
            result.put("detail", e.getMessage());
        }
        return result;
    }
}
