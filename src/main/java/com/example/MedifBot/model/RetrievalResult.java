package com.example.MedifBot.model;

import java.util.List;
import java.util.Set;

/**
 * Evidence gathered for one question:
 * - contextChunks: ordered chunk texts (course overview, ranked vector hits, keyword hits)
 * - sourceFilters: prefixes the vector search was restricted to (empty = unrestricted)
 * - bestSimilarity: highest similarity among chunks above the threshold
 * - similarCount / keywordCount / usedCount: for logging
 */
public record RetrievalResult(
        List<String> contextChunks,
        Set<String> sourceFilters,
        double bestSimilarity,
        int similarCount,
        int keywordCount,
        int usedCount
) {

    public boolean isEmpty() {
        return contextChunks == null || contextChunks.isEmpty();
    }

    public String joinedContext() {
        return isEmpty() ? "" : String.join("\n\n", contextChunks);
    }
}
