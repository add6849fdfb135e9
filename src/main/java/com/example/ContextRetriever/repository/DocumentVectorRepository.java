package com.example.ContextRetriever.repository;

import com.example.ContextRetriever.config.RetrieverProperties;
import com.example.ContextRetriever.model.DocumentOrigin;
import com.example.ContextRetriever.model.RetrievedDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Nearest-neighbour lookups against the pgvector document table
 * {@code (id, content, metadata jsonb, embedding vector, source, created_at)}.
 * Table and index creation are handled outside this service.
 */
@Repository
public class DocumentVectorRepository {

    private static final Logger log = LoggerFactory.getLogger(DocumentVectorRepository.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String nearestSql;

    public DocumentVectorRepository(JdbcTemplate jdbcTemplate,
                                    ObjectMapper objectMapper,
                                    RetrieverProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.nearestSql = buildNearestSql(properties.tableName());
    }

    /**
     * Uses the pgvector cosine distance operator {@code <=>} and reports
     * similarity as {@code 1 - distance}, best match first.
     */
    public List<RetrievedDocument> findNearest(float[] embedding, int limit) {
        PGvector queryVector = new PGvector(embedding);

        return jdbcTemplate.query(nearestSql, ps -> {
            ps.setObject(1, queryVector); // for 1 - (embedding <=> ?)
            ps.setObject(2, queryVector); // for ORDER BY embedding <=> ?
            ps.setInt(3, limit);
        }, new DocumentRowMapper());
    }

    static String buildNearestSql(String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid document table name: " + tableName);
        }
        return """
                SELECT id,
                       content,
                       metadata,
                       source,
                       1 - (embedding <=> ?) AS similarity
                FROM %s
                ORDER BY embedding <=> ?
                LIMIT ?
                """.formatted(tableName);
    }

    private class DocumentRowMapper implements RowMapper<RetrievedDocument> {
        @Override
        public RetrievedDocument mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Object> metadata = new HashMap<>();
            String metadataJson = rs.getString("metadata");
            if (metadataJson != null) {
                try {
                    metadata.putAll(objectMapper.readValue(metadataJson, METADATA_TYPE));
                } catch (JsonProcessingException e) {
                    // Unreadable metadata is dropped, the row itself is still usable
                    log.debug("Ignoring malformed metadata on document id={}", rs.getLong("id"));
                }
            }
            metadata.put("id", rs.getLong("id"));

            double similarity = rs.getDouble("similarity");
            metadata.put("similarity", similarity);

            String source = rs.getString("source");
            return new RetrievedDocument(
                    rs.getString("content"),
                    source == null ? "unknown" : source,
                    similarity,
                    DocumentOrigin.LOCAL,
                    metadata
            );
        }
    }
}
