package com.example.contextrag.infrastructure.embedding;

/**
 * Signals the retry template that some texts of a sub-batch still need another attempt.
 * Never leaves the dispatcher.
 */
class TransientEmbeddingException extends RuntimeException {

    TransientEmbeddingException(String message) {
        super(message);
    }
}
