package com.example.contextrag.infrastructure.ingest;

import com.example.contextrag.domain.model.CanonicalRecord;
import com.example.contextrag.domain.model.RawItem;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps raw captures onto {@link CanonicalRecord} through a per-source-type schema table.
 * Fields the schema does not interpret are kept as metadata.
 */
@Component
public class RecordNormalizer {

    private static final List<String> SOURCE_TYPE_FIELDS = List.of("source_type", "source");

    public static final String QUALITY_SCORE = "quality_score";
    public static final double MAX_QUALITY = 10.0;

    private final Map<String, SourceSchema> schemas;

    public RecordNormalizer() {
        this(defaultSchemas());
    }

    public RecordNormalizer(Map<String, SourceSchema> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    public static Map<String, SourceSchema> defaultSchemas() {
        Map<String, SourceSchema> m = new LinkedHashMap<>();
        m.put("default", SourceSchema.DEFAULT);
        m.put("forum", SourceSchema.FORUM);
        m.put("reddit", SourceSchema.FORUM);
        m.put("web", SourceSchema.WEB);
        m.put("asu_web", SourceSchema.WEB);
        m.put("tabular", SourceSchema.TABULAR);
        m.put("grades", SourceSchema.TABULAR);
        m.put("asu_grades", SourceSchema.TABULAR);
        return m;
    }

    public CanonicalRecord normalize(RawItem item) {
        String declaredSource = firstText(item, SOURCE_TYPE_FIELDS);
        SourceSchema schema = resolveSchema(declaredSource, item.sourceTypeHint());

        String id = firstText(item, schema.idFields());
        if (id == null) {
            throw malformed(item, "missing id");
        }

        long revision = parseRevision(item, schema);
        Instant modifiedAt = parseModifiedAt(item, schema, revision);

        Set<String> mapped = schema.mappedFields();
        String title = firstText(item, schema.titleFields());
        String content = firstText(item, schema.contentFields());
        if (content == null && schema.renderContentFromFields()) {
            content = renderFields(item, mapped, title);
        }
        if (content == null || content.isBlank()) {
            throw malformed(item, "missing content for id=" + id);
        }

        String parentId = stripPrefixes(firstText(item, schema.parentFields()), schema.parentIdPrefixes());
        String url = firstText(item, schema.urlFields());

        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : item.fields().entrySet()) {
            if (e.getValue() != null && !mapped.contains(e.getKey())) {
                metadata.put(e.getKey(), e.getValue());
            }
        }
        if (schema.nestedMetadataField() != null
                && item.get(schema.nestedMetadataField()) instanceof Map<?, ?> nested) {
            for (Map.Entry<?, ?> e : nested.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    metadata.putIfAbsent(String.valueOf(e.getKey()), e.getValue());
                }
            }
        }
        metadata.put("source", declaredSource != null ? declaredSource : schema.sourceType());
        if (schema.scoresEngagement()) {
            metadata.put(QUALITY_SCORE, qualityScore(metadata));
        }

        return new CanonicalRecord(
                id,
                schema.sourceType(),
                modifiedAt,
                revision,
                content.trim(),
                parentId,
                title,
                url,
                metadata
        );
    }

    private SourceSchema resolveSchema(String declared, String hint) {
        for (String candidate : new String[]{declared, hint}) {
            if (candidate != null) {
                SourceSchema s = schemas.get(candidate.toLowerCase(Locale.ROOT));
                if (s != null) {
                    return s;
                }
            }
        }
        return schemas.getOrDefault("default", SourceSchema.DEFAULT);
    }

    private long parseRevision(RawItem item, SourceSchema schema) {
        Object raw = first(item, schema.revisionFields());
        if (raw == null) {
            return 0L;
        }
        if (raw instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("unparseable revision '" + raw + "'",
                    item.sourceName(), item.lineNumber(), e);
        }
    }

    private Instant parseModifiedAt(RawItem item, SourceSchema schema, long revision) {
        Object raw = first(item, schema.modifiedFields());
        if (raw == null) {
            // a revision counter alone is enough to order duplicates
            if (first(item, schema.revisionFields()) != null) {
                return Instant.EPOCH;
            }
            throw malformed(item, "missing modified_at");
        }
        try {
            return Timestamps.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(e.getMessage(), item.sourceName(), item.lineNumber(), e);
        }
    }

    /**
     * Engagement score in [1, 10]: votes (up to +5), replies (up to +3), a known author (+0.5)
     * and a top-level post (+1).
     */
    static double qualityScore(Map<String, Object> metadata) {
        double q = 1.0;
        Double votes = number(metadata.get("score"));
        if (votes != null) {
            q += Math.min(votes / 10.0, 5.0);
        }
        Double replies = number(metadata.get("num_comments"));
        if (replies != null) {
            q += Math.min(replies / 5.0, 3.0);
        }
        Object author = metadata.get("author");
        if (author instanceof String a && !a.isBlank() && !"[deleted]".equals(a)) {
            q += 0.5;
        }
        if ("submission".equals(metadata.get("post_type"))) {
            q += 1.0;
        }
        return Math.max(1.0, Math.min(q, MAX_QUALITY));
    }

    private static Double number(Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String renderFields(RawItem item, Set<String> mapped, String title) {
        StringBuilder sb = new StringBuilder();
        if (title != null) {
            sb.append(title).append('\n');
        }
        for (Map.Entry<String, Object> e : item.fields().entrySet()) {
            Object v = e.getValue();
            if (mapped.contains(e.getKey()) || SOURCE_TYPE_FIELDS.contains(e.getKey())) {
                continue;
            }
            if (v instanceof Number || v instanceof Boolean || (v instanceof String s && !s.isBlank())) {
                sb.append(e.getKey()).append(": ").append(v).append('\n');
            }
        }
        String out = sb.toString().trim();
        return out.isEmpty() ? null : out;
    }

    private static String stripPrefixes(String value, List<String> prefixes) {
        if (value == null) {
            return null;
        }
        for (String p : prefixes) {
            if (value.startsWith(p)) {
                return value.substring(p.length());
            }
        }
        return value;
    }

    private static Object first(RawItem item, List<String> fields) {
        for (String f : fields) {
            Object v = item.get(f);
            if (v != null && !(v instanceof String s && s.isBlank())) {
                return v;
            }
        }
        return null;
    }

    private static String firstText(RawItem item, List<String> fields) {
        Object v = first(item, fields);
        if (v == null || v instanceof Map || v instanceof List) {
            return null;
        }
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? null : s;
    }

    private static MalformedRecordException malformed(RawItem item, String reason) {
        return new MalformedRecordException(reason, item.sourceName(), item.lineNumber());
    }
}
