package com.example.contextrag.infrastructure.vector;

import com.example.contextrag.domain.model.VectorRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * PostgreSQL + pgvector backend. Upsert is {@code INSERT ... ON CONFLICT DO UPDATE}, so
 * concurrent writers only contend on the rows they touch. Similarity is {@code 1 - (a <=> b)}.
 */
public class PgVectorStoreAdapter implements VectorStoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(PgVectorStoreAdapter.class);

    public static final String BACKEND = "pgvector";

    private static final Pattern TABLE_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)?");
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String table;
    private final int dimensions;
    private final boolean initializeSchema;

    public PgVectorStoreAdapter(JdbcTemplate jdbcTemplate,
                                ObjectMapper objectMapper,
                                String table,
                                int dimensions,
                                boolean initializeSchema) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid pgvector table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.table = table;
        this.dimensions = Math.max(0, dimensions);
        this.initializeSchema = initializeSchema;
    }

    @Override
    public void open() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            if (initializeSchema) {
                initSchema();
            }
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("pgvector backend unreachable: " + e.getMostSpecificCause().getMessage(), e);
        }
        log.info("event=vector_store_open backend={} table={} dimensions={} initSchema={}",
                BACKEND, table, dimensions, initializeSchema);
    }

    private void initSchema() {
        String vectorType = dimensions > 0 ? "vector(" + dimensions + ")" : "vector";
        jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                    chunk_id   TEXT PRIMARY KEY,
                    content    TEXT NOT NULL,
                    metadata   JSONB NOT NULL,
                    embedding  %s NOT NULL,
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """.formatted(table, vectorType));
        String indexBase = table.replace('.', '_');
        if (dimensions > 0) {
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %s_embedding_idx ON %s USING hnsw (embedding vector_cosine_ops)"
                    .formatted(indexBase, table));
        }
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %s_source_idx ON %s ((metadata ->> 'source'))"
                .formatted(indexBase, table));
    }

    @Override
    public void upsert(VectorRecord record) {
        upsertAll(List.of(record));
    }

    @Override
    public void upsertAll(List<VectorRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        String sql = """
                INSERT INTO %s (chunk_id, content, metadata, embedding, updated_at)
                VALUES (?, ?, ?::jsonb, ?, now())
                ON CONFLICT (chunk_id) DO UPDATE
                SET content = EXCLUDED.content,
                    metadata = EXCLUDED.metadata,
                    embedding = EXCLUDED.embedding,
                    updated_at = now()
                """.formatted(table);

        List<String> metadataJson = new ArrayList<>(records.size());
        for (VectorRecord r : records) {
            if (dimensions > 0 && r.embedding().length != dimensions) {
                throw new VectorRecordRejectedException(r.chunkId(), "dimension mismatch for chunk "
                        + r.chunkId() + ": expected " + dimensions + ", got " + r.embedding().length);
            }
            metadataJson.add(toJson(r.chunkId(), r.metadata()));
        }

        try {
            jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    VectorRecord r = records.get(i);
                    ps.setString(1, r.chunkId());
                    ps.setString(2, r.rawText());
                    ps.setString(3, metadataJson.get(i));
                    ps.setObject(4, new PGvector(r.embedding()));
                }

                @Override
                public int getBatchSize() {
                    return records.size();
                }
            });
        } catch (DataIntegrityViolationException e) {
            String chunkId = records.size() == 1 ? records.get(0).chunkId() : null;
            throw new VectorRecordRejectedException(chunkId, "pgvector rejected upsert: " + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("pgvector upsert failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public List<VectorMatch> query(float[] vector, int k, MetadataFilter filter) {
        if (k <= 0 || vector == null || vector.length == 0) {
            return List.of();
        }
        MetadataFilter f = filter == null ? MetadataFilter.none() : filter;
        PGvector queryVector = new PGvector(vector);

        StringBuilder sql = new StringBuilder("SELECT chunk_id, content, metadata::text AS metadata, 1 - (embedding <=> ?) AS score FROM ")
                .append(table);
        List<Map.Entry<String, String>> constraints = new ArrayList<>(f.constraints().entrySet());
        for (int i = 0; i < constraints.size(); i++) {
            sql.append(i == 0 ? " WHERE " : " AND ").append("metadata ->> ? = ?");
        }
        sql.append(" ORDER BY embedding <=> ? LIMIT ?");

        try {
            return jdbcTemplate.query(sql.toString(), ps -> {
                int idx = 1;
                ps.setObject(idx++, queryVector);
                for (Map.Entry<String, String> c : constraints) {
                    ps.setString(idx++, c.getKey());
                    ps.setString(idx++, c.getValue());
                }
                ps.setObject(idx++, queryVector);
                ps.setInt(idx, k);
            }, this::mapMatch);
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("pgvector query failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public VectorStoreStats stats() {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT count(*) FROM " + table, Long.class);
            List<Integer> dims = jdbcTemplate.queryForList(
                    "SELECT vector_dims(embedding) FROM " + table + " LIMIT 1", Integer.class);
            Map<String, Long> bySource = new LinkedHashMap<>();
            jdbcTemplate.query("SELECT coalesce(metadata ->> 'source', 'unknown') AS source, count(*) AS n FROM "
                            + table + " GROUP BY 1 ORDER BY 1",
                    rs -> {
                        bySource.put(rs.getString("source"), rs.getLong("n"));
                    });
            int dim = dims.isEmpty() || dims.get(0) == null ? dimensions : dims.get(0);
            return new VectorStoreStats(BACKEND, count == null ? 0 : count, dim, bySource);
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("pgvector stats failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public void close() {
        // the DataSource is owned by Spring and closed with the context
        log.info("event=vector_store_closed backend={} table={}", BACKEND, table);
    }

    private VectorMatch mapMatch(ResultSet rs, int rowNum) throws SQLException {
        return new VectorMatch(
                rs.getString("chunk_id"),
                rs.getString("content"),
                fromJson(rs.getString("metadata"), rs.getString("chunk_id")),
                rs.getDouble("score")
        );
    }

    private String toJson(String chunkId, Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new VectorRecordRejectedException(chunkId, "metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json, String chunkId) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("event=pgvector_metadata_unreadable chunkId={} err={}", chunkId, e.getOriginalMessage());
            return Map.of();
        }
    }
}
