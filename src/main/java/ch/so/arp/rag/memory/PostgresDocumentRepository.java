package ch.so.arp.rag.memory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * PostgreSQL + pgvector backed {@link DocumentRepository}. The {@code id}
 * column is a {@code BIGSERIAL} that defines store order, the caller visible
 * identity lives in {@code doc_id}.
 */
class PostgresDocumentRepository implements DocumentRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresDocumentRepository.class);

    private static final String COLUMNS = """
            doc_id, content, embedding::text AS embedding, metadata::text AS metadata, created_at, updated_at
            """;

    private static final String UPSERT_PREFIX = """
            INSERT INTO documents (doc_id, content, embedding, metadata)
            VALUES
            """;

    private static final String UPSERT_SUFFIX = """
            ON CONFLICT (doc_id) DO UPDATE SET
              content = EXCLUDED.content,
              embedding = EXCLUDED.embedding,
              metadata = EXCLUDED.metadata,
              updated_at = now()
            RETURNING
            """ + COLUMNS;

    private static final String SELECT_BY_ID_SQL = "SELECT " + COLUMNS + " FROM documents WHERE doc_id = :docId";

    private static final String SELECT_ALL_SQL = "SELECT " + COLUMNS + " FROM documents ORDER BY id LIMIT :limit";

    private static final String SELECT_BY_PATTERN_SQL = "SELECT " + COLUMNS + """
             FROM documents
            WHERE content ILIKE :pattern
            ORDER BY id
            LIMIT :limit
            """;

    private static final String SIMILARITY_SQL = "SELECT " + COLUMNS + """
            , 1 - (embedding <=> :embedding::vector) AS score
            FROM documents
            ORDER BY embedding <=> :embedding::vector, id
            LIMIT :limit
            """;

    private static final String COUNT_SQL = "SELECT count(*) FROM documents";

    private static final String DELETE_SQL = "DELETE FROM documents WHERE doc_id = :docId";

    private static final String DELETE_ALL_SQL = "DELETE FROM documents WHERE doc_id IN (:docIds)";

    private static final String TABLE_EXISTS_SQL = "SELECT to_regclass('documents') IS NOT NULL";

    private static final String VECTOR_PROBE_SQL = """
            SELECT count(*) FROM (
              SELECT embedding <=> :embedding::vector AS distance FROM documents LIMIT 1
            ) probe
            """;

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;
    private final int dimensions;
    private final RowMapper<Document> documentMapper = this::mapDocument;

    PostgresDocumentRepository(JdbcClient jdbcClient, ObjectMapper objectMapper, int dimensions) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dimensions = dimensions;
    }

    @Override
    public Document upsert(EmbeddedDocument document) {
        return upsertAll(List.of(document)).get(0);
    }

    @Override
    public List<Document> upsertAll(List<EmbeddedDocument> documents) {
        if (documents.isEmpty()) {
            return List.of();
        }
        // ON CONFLICT cannot touch the same row twice in one statement, the last occurrence wins
        Map<String, EmbeddedDocument> unique = new LinkedHashMap<>();
        documents.forEach(document -> unique.put(document.id(), document));

        StringJoiner values = new StringJoiner(",\n", "", "\n");
        Map<String, Object> params = new LinkedHashMap<>();
        int index = 0;
        for (EmbeddedDocument document : unique.values()) {
            values.add("(:docId%1$d, :content%1$d, :embedding%1$d::vector, :metadata%1$d::jsonb)".formatted(index));
            params.put("docId" + index, document.id());
            params.put("content" + index, document.content());
            params.put("embedding" + index, toPgVectorLiteral(document.vector()));
            params.put("metadata" + index, writeMetadata(document.metadata()));
            index++;
        }

        List<Document> written = jdbcClient.sql(UPSERT_PREFIX + values + UPSERT_SUFFIX)
                .params(params)
                .query(documentMapper)
                .list();

        // RETURNING does not guarantee VALUES order
        Map<String, Document> byId = new LinkedHashMap<>();
        written.forEach(row -> byId.put(row.id(), row));
        List<Document> ordered = new ArrayList<>(unique.size());
        for (String id : unique.keySet()) {
            Document row = byId.get(id);
            if (row == null) {
                throw new DataIntegrityViolationException("Upsert did not return row for document " + id);
            }
            ordered.add(row);
        }
        LOGGER.debug("Upserted {} documents", ordered.size());
        return ordered;
    }

    @Override
    public boolean deleteById(String id) {
        return jdbcClient.sql(DELETE_SQL).param("docId", id).update() > 0;
    }

    @Override
    public int deleteAllById(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return jdbcClient.sql(DELETE_ALL_SQL).param("docIds", Set.copyOf(ids)).update();
    }

    @Override
    public Optional<Document> findById(String id) {
        return jdbcClient.sql(SELECT_BY_ID_SQL).param("docId", id).query(documentMapper).optional();
    }

    @Override
    public long count() {
        return jdbcClient.sql(COUNT_SQL).query(Long.class).single();
    }

    @Override
    public List<Document> findByContentFragments(List<String> fragments, int limit) {
        return jdbcClient.sql(SELECT_BY_PATTERN_SQL)
                .param("pattern", toLikePattern(fragments))
                .param("limit", limit)
                .query(documentMapper)
                .list();
    }

    @Override
    public List<Document> findAll(int limit) {
        return jdbcClient.sql(SELECT_ALL_SQL).param("limit", limit).query(documentMapper).list();
    }

    @Override
    public List<SearchHit> findNearest(float[] vector, int limit) {
        return jdbcClient.sql(SIMILARITY_SQL)
                .param("embedding", toPgVectorLiteral(vector))
                .param("limit", limit)
                .query((rs, rowNum) -> new SearchHit(mapDocument(rs, rowNum), rs.getDouble("score"),
                        SearchHit.MatchSource.VECTOR))
                .list();
    }

    @Override
    public boolean isReady() {
        try {
            Boolean exists = jdbcClient.sql(TABLE_EXISTS_SQL).query(Boolean.class).single();
            if (!Boolean.TRUE.equals(exists)) {
                LOGGER.warn("Table 'documents' does not exist");
                return false;
            }
            jdbcClient.sql(VECTOR_PROBE_SQL)
                    .param("embedding", toPgVectorLiteral(new float[dimensions]))
                    .query(Long.class)
                    .single();
            return true;
        } catch (DataAccessException ex) {
            LOGGER.warn("Vector schema check failed, pgvector might not be enabled: {}", ex.getMessage());
            return false;
        }
    }

    static String toLikePattern(List<String> fragments) {
        StringBuilder builder = new StringBuilder("%");
        for (String fragment : fragments) {
            builder.append(escapeLike(fragment)).append('%');
        }
        return builder.toString();
    }

    static String toPgVectorLiteral(float[] vector) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(vector[i]);
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] parsePgVector(String literal) {
        String body = literal.trim();
        if (body.startsWith("[") && body.endsWith("]")) {
            body = body.substring(1, body.length() - 1);
        }
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Document mapDocument(ResultSet rs, int rowNum) throws SQLException {
        return new Document(
                rs.getString("doc_id"),
                rs.getString("content"),
                parsePgVector(rs.getString("embedding")),
                readMetadata(rs.getString("metadata")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }

    private String writeMetadata(ObjectNode metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? objectMapper.createObjectNode() : metadata);
        } catch (JsonProcessingException ex) {
            throw new DataIntegrityViolationException("Metadata is not serialisable: " + ex.getOriginalMessage(), ex);
        }
    }

    private ObjectNode readMetadata(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node instanceof ObjectNode objectNode) {
                return objectNode;
            }
            ObjectNode wrapper = objectMapper.createObjectNode();
            wrapper.set("value", node);
            return wrapper;
        } catch (JsonProcessingException ex) {
            throw new SQLException("Stored metadata is not valid JSON", ex);
        }
    }
}
