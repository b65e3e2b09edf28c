package com.example.MedifBot.model;

/**
 * A knowledge-base chunk returned by the vector store.
 *
 * @param text       chunk text
 * @param source     relative path of the source markdown file, e.g. "cursos/cype_summary.md"
 * @param similarity max(0, 1 - cosine distance) against the query
 */
public record EvidenceChunk(
        String text,
        String source,
        double similarity
) {
}
