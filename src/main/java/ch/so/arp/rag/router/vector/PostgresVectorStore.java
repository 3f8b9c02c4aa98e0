package ch.so.arp.rag.router.vector;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PostgreSQL backed {@link VectorStore} using the pgvector extension. The
 * schema lives in {@code db/router-schema.sql}.
 */
public class PostgresVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresVectorStore.class);

    private static final String SEARCH_SQL = """
            SELECT
              e.id AS entry_id,
              COALESCE(e.content, '') AS content,
              COALESCE(e.metadata::text, '{}') AS metadata,
              (1.0 - (e.embedding <=> :embedding::vector)) AS score
            FROM arp_rag_router.entries e
            WHERE e.embedding IS NOT NULL
            ORDER BY e.embedding <=> :embedding::vector, e.id
            LIMIT :limit;
            """;

    private static final String INSERT_SQL = """
            INSERT INTO arp_rag_router.entries (content, metadata, embedding)
            VALUES (:content, :metadata::jsonb, :embedding::vector);
            """;

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    public PostgresVectorStore(JdbcClient jdbcClient, ObjectMapper objectMapper) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public List<VectorMatch> search(float[] embedding, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        try {
            List<VectorMatch> matches = jdbcClient.sql(SEARCH_SQL)
                    .param("embedding", toPgVectorLiteral(embedding))
                    .param("limit", topK)
                    .query(new EntryRowMapper())
                    .list();
            LOGGER.debug("Similarity search returned {} entries (limit={})", matches.size(), topK);
            return matches;
        } catch (DataAccessException ex) {
            throw new StorageException("Similarity search failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void upsert(String text, float[] embedding, Map<String, Object> metadata) {
        if (text == null || embedding == null || embedding.length == 0) {
            throw new StorageException("Text and a non-empty embedding are required");
        }
        InMemoryVectorStore.validateMetadata(metadata);
        try {
            jdbcClient.sql(INSERT_SQL)
                    .param("content", text)
                    .param("metadata", objectMapper.writeValueAsString(metadata))
                    .param("embedding", toPgVectorLiteral(embedding))
                    .update();
        } catch (JsonProcessingException ex) {
            throw new StorageException("Metadata cannot be serialized", ex);
        } catch (DataAccessException ex) {
            throw new StorageException("Insert failed: " + ex.getMessage(), ex);
        }
    }

    private String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%f", embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    private Map<String, Object> readMetadata(String json) {
        try {
            Map<String, Object> metadata = objectMapper.readValue(json, METADATA_TYPE);
            metadata.values().removeIf(Objects::isNull);
            return metadata;
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Ignoring unreadable metadata: {}", ex.getMessage());
            return Map.of();
        }
    }

    private final class EntryRowMapper implements RowMapper<VectorMatch> {

        @Override
        public VectorMatch mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new VectorMatch(
                    String.valueOf(rs.getLong("entry_id")),
                    rs.getString("content"),
                    readMetadata(rs.getString("metadata")),
                    rs.getDouble("score"));
        }
    }
}
