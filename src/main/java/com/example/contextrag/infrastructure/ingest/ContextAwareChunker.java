package com.example.contextrag.infrastructure.ingest;

import com.example.contextrag.domain.model.CanonicalRecord;
import com.example.contextrag.domain.model.Chunk;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Splits canonical records into chunks that keep their place in a thread.
 *
 * <p>Replies carry a bounded ancestor chain as context. Long content is split on paragraph,
 * then sentence, then whitespace boundaries inside a {@code maxSize} window; consecutive
 * chunks overlap by at least {@code overlap} characters. Sizes are in characters.
 */
@Component
public class ContextAwareChunker {

    private static final int MAX_SNAP_BACK = 64;

    private final int maxSize;
    private final int overlap;
    private final int minSize;
    private final int contextDepth;
    private final int snippetChars;

    public ContextAwareChunker(
            @Value("${contextrag.chunk.max-size}") int maxSize,
            @Value("${contextrag.chunk.overlap}") int overlap,
            @Value("${contextrag.chunk.min-size}") int minSize,
            @Value("${contextrag.chunk.context-depth}") int contextDepth,
            @Value("${contextrag.chunk.context-snippet-chars}") int snippetChars
    ) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (overlap < 0 || overlap >= maxSize) {
            throw new IllegalArgumentException("overlap must be >= 0 and < maxSize");
        }
        if (minSize <= 0 || minSize > maxSize) {
            throw new IllegalArgumentException("minSize must be > 0 and <= maxSize");
        }
        if (contextDepth < 0) {
            throw new IllegalArgumentException("contextDepth must be >= 0");
        }
        this.maxSize = maxSize;
        this.overlap = overlap;
        this.minSize = minSize;
        this.contextDepth = contextDepth;
        this.snippetChars = Math.max(20, snippetChars);
    }

    public List<Chunk> chunk(List<CanonicalRecord> records) {
        Map<String, CanonicalRecord> index = new LinkedHashMap<>();
        for (CanonicalRecord r : records) {
            index.putIfAbsent(r.id(), r);
        }
        List<Chunk> out = new ArrayList<>();
        for (CanonicalRecord r : records) {
            out.addAll(chunkRecord(r, index));
        }
        return out;
    }

    public List<Chunk> chunkRecord(CanonicalRecord record, Map<String, CanonicalRecord> index) {
        List<CanonicalRecord> ancestors = ancestors(record, index);
        List<String> context = new ArrayList<>(ancestors.size());
        for (CanonicalRecord a : ancestors) {
            context.add(snippet(a));
        }

        String title = record.title();
        if (title == null) {
            for (CanonicalRecord a : ancestors) {
                if (a.title() != null) {
                    title = a.title();
                    break;
                }
            }
        }

        String content = record.content();
        List<Span> spans = split(content);
        List<Chunk> chunks = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            String text = content.substring(span.start(), span.end());
            String contentHash = sha256(text);

            Map<String, Object> md = new LinkedHashMap<>(record.metadata());
            md.put("record_id", record.id());
            md.put("source_type", record.sourceType());
            md.put("modified_at", record.modifiedAt().toString());
            md.put("revision", record.revision());
            md.put("chunk_index", i);
            md.put("chunk_count", spans.size());
            md.put("start_offset", span.start());
            md.put("end_offset", span.end());
            md.put("content_hash", contentHash);
            md.put("context_depth", ancestors.size());
            md.put("truncated", span.truncated());
            if (title != null) {
                md.put("title", title);
            }
            if (record.url() != null) {
                md.put("url", record.url());
            }
            if (record.hasParent()) {
                md.put("parent_id", record.parentId());
            }

            chunks.add(new Chunk(
                    chunkId(record.id(), i, span.start(), contentHash),
                    record.id(),
                    i,
                    span.start(),
                    span.end(),
                    text,
                    context,
                    md
            ));
        }
        return chunks;
    }

    public int maxSize() {
        return maxSize;
    }

    public int overlap() {
        return overlap;
    }

    public static String chunkId(String recordId, int splitIndex, int startOffset, String contentHash) {
        return sha256(recordId + "|" + splitIndex + "|" + startOffset + "|" + contentHash).substring(0, 32);
    }

    List<Span> split(String text) {
        int len = text.length();
        if (len <= maxSize) {
            return List.of(new Span(0, len, false));
        }

        List<Span> spans = new ArrayList<>();
        int start = 0;
        while (start < len) {
            if (len - start <= maxSize) {
                spans.add(new Span(start, len, false));
                break;
            }

            int hardEnd = start + maxSize;
            int lower = start + Math.max(minSize, overlap + 1);
            int end = findBoundary(text, lower, hardEnd);

            if (end < 0) {
                // a token straddles the window: end this chunk early, before the token
                int early = lastWhitespaceBoundary(text, start + 2, lower - 1);
                if (early > 0) {
                    spans.add(new Span(start, early, false));
                    start = early;
                    while (start < len && Character.isWhitespace(text.charAt(start))) {
                        start++;
                    }
                    continue;
                }
            }

            if (end < 0) {
                // one unbroken token fills the window: keep maxSize chars, skip the rest of it
                spans.add(new Span(start, hardEnd, true));
                int resume = hardEnd;
                while (resume < len && !Character.isWhitespace(text.charAt(resume))) {
                    resume++;
                }
                while (resume < len && Character.isWhitespace(text.charAt(resume))) {
                    resume++;
                }
                start = resume;
                continue;
            }

            spans.add(new Span(start, end, false));

            int next = end - overlap;
            if (len - next < minSize) {
                next = len - minSize;
            }
            start = snapToTokenStart(text, next, start + 1);
        }
        return spans;
    }

    /**
     * Rightmost split point in [lower, hardEnd], trying paragraph, sentence, then whitespace
     * boundaries. The returned index always follows a whitespace character.
     */
    private static int findBoundary(String text, int lower, int hardEnd) {
        for (int i = hardEnd; i >= lower && i >= 2; i--) {
            if (text.charAt(i - 1) == '\n' && text.charAt(i - 2) == '\n') {
                return i;
            }
        }
        for (int i = hardEnd; i >= lower && i >= 2; i--) {
            if (Character.isWhitespace(text.charAt(i - 1)) && isSentenceEnd(text.charAt(i - 2))) {
                return i;
            }
        }
        for (int i = hardEnd; i >= lower && i >= 1; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }

    private static int lastWhitespaceBoundary(String text, int from, int to) {
        for (int i = to; i >= from; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isSentenceEnd(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static int snapToTokenStart(String text, int pos, int floor) {
        int p = pos;
        int steps = 0;
        while (p > floor && steps < MAX_SNAP_BACK && !Character.isWhitespace(text.charAt(p - 1))) {
            p--;
            steps++;
        }
        if (p > floor && Character.isWhitespace(text.charAt(p - 1))) {
            return p;
        }
        return Math.max(pos, floor);
    }

    private List<CanonicalRecord> ancestors(CanonicalRecord record, Map<String, CanonicalRecord> index) {
        if (contextDepth == 0 || !record.hasParent()) {
            return List.of();
        }
        List<CanonicalRecord> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(record.id());

        CanonicalRecord current = record;
        while (chain.size() < contextDepth && current.hasParent()) {
            CanonicalRecord parent = index.get(current.parentId());
            if (parent == null || !seen.add(parent.id())) {
                break;
            }
            chain.add(parent);
            current = parent;
        }
        Collections.reverse(chain);
        return chain;
    }

    private String snippet(CanonicalRecord r) {
        String body = r.content().replaceAll("\\s+", " ").trim();
        if (body.length() > snippetChars) {
            body = body.substring(0, snippetChars) + "...";
        }
        return r.title() == null ? body : r.title() + " | " + body;
    }

    private static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    record Span(int start, int end, boolean truncated) {
    }
}
