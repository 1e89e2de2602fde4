package com.example.contextrag.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema-normalized record. After merge exactly one instance survives per {@code id}.
 */
public record CanonicalRecord(
        String id,
        String sourceType,
        Instant modifiedAt,
        long revision,
        String content,
        String parentId,
        String title,
        String url,
        Map<String, Object> metadata
) {
    public CanonicalRecord {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasParent() {
        return parentId != null && !parentId.isBlank();
    }
}
