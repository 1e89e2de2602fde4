package com.example.contextrag.domain.model;

import java.util.Map;

public record RetrievedChunk(
        String chunkId,
        String content,
        Map<String, Object> metadata,
        double similarityScore,
        double rerankScore
) {
}
