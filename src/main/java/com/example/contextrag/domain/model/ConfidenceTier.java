package com.example.contextrag.domain.model;

public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW;

    public static ConfidenceTier of(double score) {
        if (score >= 0.8) {
            return HIGH;
        }
        if (score >= 0.6) {
            return MEDIUM;
        }
        return LOW;
    }
}
