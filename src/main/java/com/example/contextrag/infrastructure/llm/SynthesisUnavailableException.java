package com.example.contextrag.infrastructure.llm;

public class SynthesisUnavailableException extends RuntimeException {

    public SynthesisUnavailableException(String message) {
        super(message);
    }

    public SynthesisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
