package com.example.contextrag.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One captured item as it arrived on the wire: the raw JSON object plus where it came from.
 * Field names differ between source types, so nothing is interpreted here.
 */
public record RawItem(
        Map<String, Object> fields,
        String sourceTypeHint,
        String sourceName,
        long lineNumber
) {
    public RawItem {
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }
}
