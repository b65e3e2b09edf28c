package com.example.MedifBot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunables for the chat pipeline, bound from the {@code medif.*} keys in application.yml.
 * Defaults mirror the production values so unit tests can use {@code new ChatbotProperties()}.
 */
@Configuration
@ConfigurationProperties(prefix = "medif")
@Getter
@Setter
public class ChatbotProperties {

    private Rag rag = new Rag();
    private History history = new History();
    private Generation generation = new Generation();
    private Pacing pacing = new Pacing();

    @Getter
    @Setter
    public static class Rag {
        /** Minimum cosine similarity (0..1) a chunk needs to reach the prompt. */
        private double minSimilarity = 0.6;

        /** How many nearest chunks to request from pgvector. */
        private int topK = 8;

        /** Hard cap on chunks sent to the model. */
        private int contextChunkLimit = 5;

        /** Candidates fetched by the keyword fallback search. */
        private int keywordMatchChunks = 2;

        private int maxContextChars = 2200;

        private String courseOverviewPath = "overview_cursos.md";

        private int embeddingDimension = 1536;

        private int embeddingCacheSize = 256;
    }

    @Getter
    @Setter
    public static class History {
        /** Turns rendered into the prompt. */
        private int maxTurns = 4;

        private int maxChars = 800;

        /** Messages kept per conversation in the Redis window. */
        private int redisWindow = 10;

        private Duration ttl = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Generation {
        private String model = "deepseek";
        private double temperature = 0.0;
        private double topP = 1.0;
    }

    @Getter
    @Setter
    public static class Pacing {
        private Duration contactDelay = Duration.ofMillis(1500);
        private Duration socialDelay = Duration.ofSeconds(7);
    }
}
