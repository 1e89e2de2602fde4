package com.example.contextrag.domain.model;

import java.util.List;

public record ClarificationQuestion(
        String question,
        List<String> options,
        String context,
        String fieldName
) {
    public ClarificationQuestion {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
