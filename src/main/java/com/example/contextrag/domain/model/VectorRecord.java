package com.example.contextrag.domain.model;

import java.util.Map;

/**
 * Persisted unit of the vector store. Written only through upsert, keyed by {@code chunkId}.
 */
public record VectorRecord(
        String chunkId,
        float[] embedding,
        Map<String, Object> metadata,
        String rawText
) {
    public VectorRecord {
        if (chunkId == null || chunkId.isBlank()) {
            throw new IllegalArgumentException("chunkId is required");
        }
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("embedding is required for chunk " + chunkId);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        rawText = rawText == null ? "" : rawText;
    }
}
