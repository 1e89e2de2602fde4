package com.example.contextrag.application.analysis;

/**
 * Assigns a question to one topic category of the catalog.
 */
public interface TopicClassifier {

    /**
     * @param question user question, possibly with prior answers appended
     * @return the best category, or {@link Classification#unclassified()} when nothing matches
     */
    Classification classify(String question);
}
