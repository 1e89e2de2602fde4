package com.example.contextrag.application.analysis;

import com.example.contextrag.domain.model.QueryAnalysis;
import java.util.List;

/**
 * @param category   category name, or {@link QueryAnalysis#UNCLASSIFIED}
 * @param confidence certainty of the assignment in [0,1]; 0 when unclassified
 * @param matched    surface terms that triggered the category
 */
public record Classification(String category, double confidence, List<String> matched) {

    private static final Classification UNCLASSIFIED = new Classification(QueryAnalysis.UNCLASSIFIED, 0.0, List.of());

    public Classification {
        matched = matched == null ? List.of() : List.copyOf(matched);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static Classification unclassified() {
        return UNCLASSIFIED;
    }

    public boolean isClassified() {
        return !QueryAnalysis.UNCLASSIFIED.equals(category);
    }
}
