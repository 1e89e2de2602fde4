package com.example.contextrag.application.analysis;

import com.example.contextrag.domain.model.RetrievalResult;
import com.example.contextrag.domain.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Scores how much an answer can be trusted, in [0,1].
 *
 * <pre>
 * raw = w_sim * mean(top-N blended) + w_cov * min(1, relevant / target) + w_cat * categoryConfidence
 *       - vaguenessPenalty (if vague) - timeoutPenalty (if timed out)
 * </pre>
 * then capped when synthesis was unavailable or retrieval came back empty.
 * Blended score of a result = mean of its similarity and rerank scores.
 */
@Component
public class ConfidenceScorer {

    public record Signals(
            RetrievalResult retrieval,
            double categoryConfidence,
            boolean vague,
            boolean synthesized,
            boolean timedOut
    ) {
    }

    private final ConfidenceWeights weights;

    public ConfidenceScorer(ConfidenceWeights weights) {
        this.weights = weights;
    }

    public double score(Signals s) {
        List<Double> blended = new ArrayList<>();
        if (s.retrieval() != null) {
            for (RetrievedChunk c : s.retrieval().chunks()) {
                blended.add(blend(c));
            }
        }
        blended.sort(Comparator.reverseOrder());

        double similarityTerm = 0.0;
        int n = Math.min(weights.topN(), blended.size());
        for (int i = 0; i < n; i++) {
            similarityTerm += blended.get(i);
        }
        similarityTerm = n == 0 ? 0.0 : similarityTerm / n;

        long relevant = blended.stream().filter(b -> b >= weights.relevanceThreshold()).count();
        double coverageTerm = Math.min(1.0, (double) relevant / weights.coverageTarget());

        double raw = weights.similarity() * similarityTerm
                + weights.coverage() * coverageTerm
                + weights.category() * clamp01(s.categoryConfidence());

        if (s.vague()) {
            raw -= weights.vaguenessPenalty();
        }
        if (s.timedOut()) {
            raw -= weights.timeoutPenalty();
        }
        if (!s.synthesized()) {
            raw = Math.min(raw, weights.synthesisCap());
        }
        if (blended.isEmpty()) {
            raw = Math.min(raw, weights.emptyRetrievalCap());
        }
        return clamp01(raw);
    }

    public ConfidenceWeights weights() {
        return weights;
    }

    private static double blend(RetrievedChunk c) {
        return (clamp01(c.similarityScore()) + clamp01(c.rerankScore())) / 2.0;
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
