package com.example.MedifBot.repository;

import com.example.MedifBot.model.EvidenceChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only access to the {@code documents} table filled by the ingestion job.
 * Columns used: text, source, filepath, normalized_text, embedding (vector), created_at.
 */
@Repository
@RequiredArgsConstructor
public class KnowledgeChunkRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<EvidenceChunk> SCORED_CHUNK_MAPPER = (rs, rowNum) -> new EvidenceChunk(
            rs.getString("text"),
            rs.getString("source"),
            Math.max(0.0, 1.0 - rs.getDouble("cosine_distance"))
    );

    /**
     * Nearest chunks by pgvector cosine distance {@code <=>}, closest first.
     * When {@code sourcePrefixes} is non-empty only sources starting with one of them are searched.
     */
    public List<EvidenceChunk> searchSimilar(float[] embedding, int topK, Collection<String> sourcePrefixes) {
        PGvector queryVector = new PGvector(embedding);
        boolean filtered = sourcePrefixes != null && !sourcePrefixes.isEmpty();

        StringBuilder sql = new StringBuilder("""
                SELECT text,
                       source,
                       embedding <=> ? AS cosine_distance
                FROM documents
                """);
        if (filtered) {
            sql.append("WHERE source ILIKE ANY (?)\n");
        }
        sql.append("""
                ORDER BY cosine_distance ASC
                LIMIT ?
                """);

        String[] patterns = filtered ? toPrefixPatterns(sourcePrefixes) : null;
        return jdbcTemplate.query(sql.toString(), ps -> {
            int index = 1;
            ps.setObject(index++, queryVector);
            if (patterns != null) {
                Array array = ps.getConnection().createArrayOf("text", patterns);
                ps.setArray(index++, array);
            }
            ps.setInt(index, topK);
        }, SCORED_CHUNK_MAPPER);
    }

    /**
     * Chunks whose normalized text contains any of the keywords (case-insensitive),
     * exact duplicate texts removed.
     */
    public List<String> findTextsWithKeywords(Collection<String> keywords, int maxResults) {
        List<String> patterns = new ArrayList<>();
        for (String keyword : keywords) {
            String trimmed = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                patterns.add("%" + trimmed + "%");
            }
        }
        if (patterns.isEmpty()) {
            return List.of();
        }

        String sql = """
                SELECT text
                FROM documents
                WHERE normalized_text ILIKE ANY (?)
                LIMIT ?
                """;
        List<String> rows = jdbcTemplate.query(sql, ps -> {
            ps.setArray(1, ps.getConnection().createArrayOf("text", patterns.toArray(String[]::new)));
            ps.setInt(2, maxResults);
        }, (rs, rowNum) -> rs.getString("text"));

        Set<String> unique = new LinkedHashSet<>(rows);
        return new ArrayList<>(unique);
    }

    /** All chunks of the given files, newest first. Similarity is reported as 1.0. */
    public List<EvidenceChunk> findByFilepaths(Collection<String> filepaths) {
        if (filepaths == null || filepaths.isEmpty()) {
            return List.of();
        }
        String sql = """
                SELECT text, source
                FROM documents
                WHERE filepath = ANY (?)
                ORDER BY created_at DESC
                """;
        String[] paths = filepaths.toArray(String[]::new);
        return jdbcTemplate.query(sql,
                ps -> ps.setArray(1, ps.getConnection().createArrayOf("text", paths)),
                (rs, rowNum) -> new EvidenceChunk(rs.getString("text"), rs.getString("source"), 1.0));
    }

    private static String[] toPrefixPatterns(Collection<String> prefixes) {
        return prefixes.stream()
                .map(prefix -> prefix.endsWith("/") ? prefix : prefix + "/")
                .map(prefix -> prefix + "%")
                .toArray(String[]::new);
    }
}
