package com.example.contextrag.infrastructure.embedding;

import java.util.List;

/**
 * Boundary to the external embedding service.
 */
public interface EmbeddingClient {

    /**
     * Embeds a batch of texts.
     *
     * @return exactly one outcome per input text, in input order
     */
    List<EmbeddingOutcome> embed(List<String> texts);

    /**
     * Identifies the model and version; query and corpus vectors must share it.
     */
    String modelId();
}
