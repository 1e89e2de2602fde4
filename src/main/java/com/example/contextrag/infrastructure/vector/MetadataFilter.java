package com.example.contextrag.infrastructure.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of metadata equality constraints. Values are compared by their string form,
 * so {@code 3} and {@code "3"} match.
 */
public final class MetadataFilter {

    private static final MetadataFilter NONE = new MetadataFilter(Map.of());

    private final Map<String, String> equals;

    private MetadataFilter(Map<String, String> equals) {
        this.equals = equals;
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter eq(String key, Object value) {
        return NONE.and(key, value);
    }

    public MetadataFilter and(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("filter key is required");
        }
        if (value == null) {
            return this;
        }
        Map<String, String> next = new LinkedHashMap<>(equals);
        next.put(key, String.valueOf(value));
        return new MetadataFilter(Collections.unmodifiableMap(next));
    }

    public Map<String, String> constraints() {
        return equals;
    }

    public boolean isEmpty() {
        return equals.isEmpty();
    }

    public boolean matches(Map<String, Object> metadata) {
        for (Map.Entry<String, String> e : equals.entrySet()) {
            Object v = metadata == null ? null : metadata.get(e.getKey());
            if (v == null || !Objects.equals(e.getValue(), String.valueOf(v))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetadataFilter other && equals.equals(other.equals);
    }

    @Override
    public int hashCode() {
        return equals.hashCode();
    }

    @Override
    public String toString() {
        return equals.toString();
    }
}
