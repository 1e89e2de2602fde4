package com.example.contextrag.domain.model;

import java.util.List;
import java.util.Map;

/**
 * A retrieval-sized span of one record's content together with its thread context.
 *
 * <p>{@code text} is the focal span, {@code content.substring(startOffset, endOffset)} of the
 * owning record. {@code context} holds ancestor snippets, root first.
 */
public record Chunk(
        String chunkId,
        String recordId,
        int splitIndex,
        int startOffset,
        int endOffset,
        String text,
        List<String> context,
        Map<String, Object> metadata
) {
    public Chunk {
        context = context == null ? List.of() : List.copyOf(context);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Text sent to the embedding model: context and focal content in labelled sections.
     */
    public String embeddingText() {
        if (context.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder("Context:\n");
        for (String c : context) {
            sb.append("> ").append(c).append('\n');
        }
        sb.append("\nContent:\n").append(text);
        return sb.toString();
    }
}
