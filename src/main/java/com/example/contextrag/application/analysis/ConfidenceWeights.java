package com.example.contextrag.application.analysis;

/**
 * Tunables of the answer confidence score. The three weights are normalized when they sum to
 * more than one.
 *
 * @param similarity          weight of the mean blended score of the top results
 * @param coverage            weight of how many results clear the relevance threshold
 * @param category            weight of the topic classification confidence
 * @param vaguenessPenalty    subtracted when the question was judged vague
 * @param timeoutPenalty      subtracted when the request ran out of time
 * @param synthesisCap        upper bound when no synthesized answer could be produced
 * @param emptyRetrievalCap   upper bound when nothing was retrieved
 * @param topN                results averaged for the similarity term
 * @param relevanceThreshold  blended score a result needs to count towards coverage
 * @param coverageTarget      relevant results that give full coverage
 */
public record ConfidenceWeights(
        double similarity,
        double coverage,
        double category,
        double vaguenessPenalty,
        double timeoutPenalty,
        double synthesisCap,
        double emptyRetrievalCap,
        int topN,
        double relevanceThreshold,
        int coverageTarget
) {
    public ConfidenceWeights {
        if (similarity < 0 || coverage < 0 || category < 0) {
            throw new IllegalArgumentException("confidence weights must be >= 0");
        }
        double sum = similarity + coverage + category;
        if (sum == 0) {
            throw new IllegalArgumentException("at least one confidence weight must be > 0");
        }
        if (sum > 1.0) {
            similarity /= sum;
            coverage /= sum;
            category /= sum;
        }
        if (topN <= 0 || coverageTarget <= 0) {
            throw new IllegalArgumentException("topN and coverageTarget must be > 0");
        }
    }

    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(0.5, 0.3, 0.2, 0.1, 0.2, 0.5, 0.2, 3, 0.5, 3);
    }
}
