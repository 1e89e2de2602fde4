package com.example.contextrag.domain.model;

import java.util.List;

/**
 * Per-request analysis state. Nothing here outlives the request.
 */
public record QueryAnalysis(
        String category,
        double categoryConfidence,
        boolean vague,
        List<ClarificationQuestion> clarificationQuestions,
        List<String> followUpQuestions,
        List<String> actionItems,
        List<String> relatedTopics
) {
    public static final String UNCLASSIFIED = "unclassified";

    public QueryAnalysis {
        clarificationQuestions = clarificationQuestions == null ? List.of() : List.copyOf(clarificationQuestions);
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
        relatedTopics = relatedTopics == null ? List.of() : List.copyOf(relatedTopics);
    }

    public boolean isClassified() {
        return !UNCLASSIFIED.equals(category);
    }

    public boolean needsClarification() {
        return vague && !clarificationQuestions.isEmpty();
    }
}
