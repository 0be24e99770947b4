package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.dto.TigerMatch;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * pgvector 기반 호랑이 갤러리 검색.
 *
 * 필요한 스키마:
 * CREATE EXTENSION IF NOT EXISTS vector;
 * CREATE TABLE tiger_image_embeddings (image_id varchar(36) PRIMARY KEY, tiger_id varchar(36), embedding vector(2048));
 * CREATE INDEX ON tiger_image_embeddings USING hnsw (embedding vector_cosine_ops);
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PgVectorTigerGallery implements TigerGallery {

    private static final String MATCH_SQL = """
            SELECT e.image_id, e.tiger_id, t.name AS tiger_name,
                   1 - (e.embedding <=> ?::vector) AS similarity
            FROM tiger_image_embeddings e
            LEFT JOIN tigers t ON t.tiger_id = e.tiger_id
            WHERE e.embedding IS NOT NULL
              AND 1 - (e.embedding <=> ?::vector) >= ?
            ORDER BY e.embedding <=> ?::vector
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;

    private volatile boolean pgvectorAvailable = false;

    @PostConstruct
    public void init() {
        try {
            Integer tableExists = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM information_schema.tables WHERE table_name = 'tiger_image_embeddings'",
                    Integer.class);
            pgvectorAvailable = tableExists != null && tableExists > 0;
            if (pgvectorAvailable) {
                log.info("Tiger gallery initialized: pgvector table available");
            } else {
                log.warn("Tiger gallery: tiger_image_embeddings table not found - identification will degrade");
            }
        } catch (Exception e) {
            log.warn("Tiger gallery: database check failed ({}) - identification will degrade", e.getMessage());
            pgvectorAvailable = false;
        }
    }

    @Override
    public List<TigerMatch> findMatches(float[] embedding, double minSimilarity, int limit) {
        if (!pgvectorAvailable) {
            throw new IllegalStateException("Tiger gallery is not available");
        }
        String vector = vectorToString(embedding);
        return jdbcTemplate.query(MATCH_SQL,
                (rs, rowNum) -> new TigerMatch(
                        rs.getString("tiger_id"),
                        rs.getString("tiger_name"),
                        rs.getString("image_id"),
                        rs.getDouble("similarity")),
                vector, vector, minSimilarity, vector, limit);
    }

    static String vectorToString(float[] embedding) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(embedding[i]);
        }
        return sb.append(']').toString();
    }
}
