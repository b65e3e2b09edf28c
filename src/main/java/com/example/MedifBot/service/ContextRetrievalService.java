package com.example.MedifBot.service;

import com.example.MedifBot.config.ChatbotProperties;
import com.example.MedifBot.exception.RetrievalException;
import com.example.MedifBot.intent.TopicIntentDetector;
import com.example.MedifBot.model.EvidenceChunk;
import com.example.MedifBot.model.RetrievalResult;
import com.example.MedifBot.repository.KnowledgeChunkRepository;
import com.example.MedifBot.util.KeywordExtractor;
import com.example.MedifBot.util.TextNormalizer;
import com.example.MedifBot.util.VectorMath;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hybrid retrieval for one question:
 * 1. Embed the question
 * 2. Vector search, restricted to the topic prefixes inferred from the question
 * 3. Drop chunks below the similarity threshold
 * 4. Rank by source priority, then similarity; dedup by source and by text; cap
 * 5. Put the course overview first for course questions
 * 6. Fill remaining slots with keyword matches that pass the same similarity check
 *
 * This service does NOT call the chat model.
 */
@Service
@RequiredArgsConstructor
public class ContextRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(ContextRetrievalService.class);

    private final EmbeddingService embeddingService;
    private final KnowledgeChunkRepository chunkRepository;
    private final TopicIntentDetector topicIntentDetector;
    private final ChatbotProperties properties;

    /** Convenience entry point that derives keywords and intent from the raw question. */
    public RetrievalResult retrieve(String question) {
        String normalized = TextNormalizer.normalize(question);
        return retrieve(question,
                KeywordExtractor.extract(question),
                normalized,
                topicIntentDetector.isCourseRequest(normalized));
    }

    /**
     * @throws RetrievalException if embedding the question or the vector search fails
     */
    public RetrievalResult retrieve(String message,
                                    List<String> keywords,
                                    String normalizedMessage,
                                    boolean courseIntent) {
        ChatbotProperties.Rag rag = properties.getRag();
        double minSimilarity = rag.getMinSimilarity();
        int limit = rag.getContextChunkLimit();

        String normalizedForFilters = normalizedMessage != null
                ? normalizedMessage
                : TextNormalizer.normalize(message);
        Set<String> sourceFilters = topicIntentDetector.inferSourceFilters(normalizedForFilters);

        float[] queryEmbedding;
        List<EvidenceChunk> similarChunks;
        try {
            queryEmbedding = embeddingService.embed(message);
            // A narrowed search that comes back empty is not retried unfiltered.
            similarChunks = chunkRepository.searchSimilar(queryEmbedding, rag.getTopK(), sourceFilters);
        } catch (RuntimeException ex) {
            throw new RetrievalException("Embedding or vector search failed: " + ex.getMessage(), ex);
        }

        List<EvidenceChunk> validChunks = similarChunks.stream()
                .filter(chunk -> chunk.similarity() >= minSimilarity)
                .toList();
        double bestSimilarity = validChunks.stream()
                .mapToDouble(EvidenceChunk::similarity)
                .max()
                .orElse(0.0);

        List<String> contextChunks = new ArrayList<>();
        Set<String> dedupTexts = new HashSet<>();

        if (courseIntent) {
            addCourseOverview(contextChunks, dedupTexts);
        }

        for (String chunkText : selectContextChunks(validChunks, limit)) {
            if (contextChunks.size() >= limit) {
                break;
            }
            addIfNew(chunkText, contextChunks, dedupTexts);
        }

        int keywordCount = 0;
        if (contextChunks.size() < limit) {
            List<String> keywordChunks = validateKeywordChunks(
                    queryEmbedding, keywords, dedupTexts, limit - contextChunks.size());
            keywordCount = keywordChunks.size();
            contextChunks.addAll(keywordChunks);
        }

        return new RetrievalResult(
                List.copyOf(contextChunks),
                Collections.unmodifiableSet(sourceFilters),
                bestSimilarity,
                validChunks.size(),
                keywordCount,
                contextChunks.size()
        );
    }

    /**
     * Order by source priority then descending similarity and keep at most {@code limit}
     * chunks, at most one per source and no two with the same text.
     */
    List<String> selectContextChunks(List<EvidenceChunk> chunks, int limit) {
        List<EvidenceChunk> sorted = chunks.stream()
                .filter(chunk -> chunk.text() != null && !chunk.text().isBlank())
                .sorted(Comparator.comparingInt((EvidenceChunk chunk) -> chunkPriority(chunk.source()))
                        .thenComparing(EvidenceChunk::similarity, Comparator.reverseOrder()))
                .toList();

        List<String> selected = new ArrayList<>();
        Set<String> seenSources = new HashSet<>();
        Set<String> seenTexts = new HashSet<>();
        for (EvidenceChunk chunk : sorted) {
            if (selected.size() >= limit) {
                break;
            }
            String text = chunk.text().strip();
            String source = chunk.source() == null ? "" : chunk.source();
            String key = TextNormalizer.normalize(text);
            if (seenSources.contains(source) || seenTexts.contains(key)) {
                continue;
            }
            selected.add(text);
            seenSources.add(source);
            seenTexts.add(key);
        }
        return selected;
    }

    /**
     * 0 for routing.md, 1 for summaries and FAQ files, 2 for everything else, 3 when the source is unknown.
     */
    static int chunkPriority(String source) {
        if (source == null || source.isBlank()) {
            return 3;
        }
        String normalized = source.replace('\\', '/');
        String basename = normalized.substring(normalized.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (basename.equals("routing.md")) {
            return 0;
        }
        if (basename.endsWith("_summary.md") || basename.equals("faq.md")) {
            return 1;
        }
        if (basename.startsWith("faq_") && basename.endsWith(".md")) {
            return 1;
        }
        return 2;
    }

    private void addCourseOverview(List<String> contextChunks, Set<String> dedupTexts) {
        String overviewPath = properties.getRag().getCourseOverviewPath();
        List<EvidenceChunk> overviewChunks;
        try {
            overviewChunks = chunkRepository.findByFilepaths(List.of(overviewPath));
        } catch (RuntimeException ex) {
            log.warn("Could not load course overview '{}': {}", overviewPath, ex.getMessage());
            return;
        }
        for (EvidenceChunk chunk : overviewChunks) {
            if (addIfNew(chunk.text(), contextChunks, dedupTexts)) {
                return;
            }
        }
        log.debug("Course overview '{}' has no usable chunk", overviewPath);
    }

    /**
     * Keyword matches re-scored against the query embedding. Each candidate is embedded
     * on its own and kept only when its similarity reaches the threshold.
     */
    private List<String> validateKeywordChunks(float[] queryEmbedding,
                                               List<String> keywords,
                                               Set<String> dedupTexts,
                                               int slots) {
        if (keywords == null || keywords.isEmpty() || slots <= 0) {
            return List.of();
        }
        ChatbotProperties.Rag rag = properties.getRag();

        List<String> candidates;
        try {
            candidates = chunkRepository.findTextsWithKeywords(keywords, rag.getKeywordMatchChunks());
        } catch (RuntimeException ex) {
            log.warn("Keyword search failed for keywords={}: {}", keywords, ex.getMessage());
            return List.of();
        }

        List<String> validated = new ArrayList<>();
        for (String candidate : candidates) {
            if (validated.size() >= slots) {
                break;
            }
            String trimmed = candidate == null ? "" : candidate.strip();
            String key = TextNormalizer.normalize(trimmed);
            if (key.isEmpty() || dedupTexts.contains(key)) {
                continue;
            }
            float[] candidateEmbedding;
            try {
                candidateEmbedding = embeddingService.embed(trimmed);
            } catch (RuntimeException ex) {
                log.error("Error embedding keyword chunk", ex);
                continue;
            }
            double similarity = VectorMath.dot(queryEmbedding, candidateEmbedding);
            if (similarity >= rag.getMinSimilarity()) {
                validated.add(trimmed);
                dedupTexts.add(key);
            } else {
                log.debug("Keyword chunk rejected, similarity={}", String.format(Locale.US, "%.3f", similarity));
            }
        }
        return validated;
    }

    private static boolean addIfNew(String text, List<String> contextChunks, Set<String> dedupTexts) {
        String trimmed = text == null ? "" : text.strip();
        String key = TextNormalizer.normalize(trimmed);
        if (key.isEmpty() || dedupTexts.contains(key)) {
            return false;
        }
        contextChunks.add(trimmed);
        dedupTexts.add(key);
        return true;
    }
}
