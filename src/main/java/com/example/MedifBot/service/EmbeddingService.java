package com.example.MedifBot.service;

import com.example.MedifBot.config.ChatbotProperties;
import com.example.MedifBot.util.TextNormalizer;
import com.example.MedifBot.util.VectorMath;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * Unit-length query embeddings with a bounded in-memory cache,
 * so repeated prompts and re-validated keyword chunks do not hit the model twice.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;
    private final int dimension;
    private final Cache<String, float[]> cache;

    public EmbeddingService(EmbeddingModel embeddingModel, ChatbotProperties properties) {
        this.embeddingModel = embeddingModel;
        this.dimension = properties.getRag().getEmbeddingDimension();
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getRag().getEmbeddingCacheSize())
                .build();
    }

    /**
     * Embed {@code text} after whitespace cleanup.
     *
     * @throws IllegalArgumentException if the text is blank or the model returns a vector
     *                                  of the wrong dimension
     */
    public float[] embed(String text) {
        String cleaned = TextNormalizer.cleanWhitespace(text);
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("Input text must contain readable characters.");
        }
        return cache.get(cleaned, this::requestEmbedding).clone();
    }

    public int dimension() {
        return dimension;
    }

    private float[] requestEmbedding(String cleaned) {
        long start = System.currentTimeMillis();
        float[] raw = embeddingModel.embed(cleaned);
        log.debug("Embedded {} chars in {} ms", cleaned.length(), System.currentTimeMillis() - start);
        return VectorMath.normalize(raw, dimension);
    }
}
