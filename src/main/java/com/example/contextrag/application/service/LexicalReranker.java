package com.example.contextrag.application.service;

import com.example.contextrag.domain.model.RetrievedChunk;
import com.example.contextrag.infrastructure.ingest.RecordNormalizer;
import com.example.contextrag.infrastructure.vector.VectorMatch;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reranks by query-term coverage, query-bigram coverage, recency and engagement quality.
 *
 * <p>Recency is a half-life decay measured from the newest candidate, so the score only depends
 * on the candidate set. Quality comes from the {@code quality_score} forum records carry; chunks
 * without one score {@value #NEUTRAL_QUALITY}. Ties fall back to similarity, then newer
 * {@code modified_at}, then chunk id.
 */
@Service
public class LexicalReranker implements Reranker {

    private static final Logger log = LoggerFactory.getLogger(LexicalReranker.class);

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "of", "to", "in", "on", "for", "is", "are", "was", "were",
            "be", "i", "me", "my", "you", "your", "we", "it", "its", "at", "by", "with", "what", "how",
            "do", "does", "can", "want", "about", "this", "that", "there", "any", "some"
    );

    static final double NEUTRAL_QUALITY = 0.5;

    private static final Comparator<RetrievedChunk> ORDER =
            Comparator.comparingDouble(RetrievedChunk::rerankScore).reversed()
                    .thenComparing(Comparator.comparingDouble(RetrievedChunk::similarityScore).reversed())
                    .thenComparing((RetrievedChunk c) -> modifiedAt(c.metadata()), Comparator.reverseOrder())
                    .thenComparing(RetrievedChunk::chunkId);

    private final double termWeight;
    private final double bigramWeight;
    private final double recencyWeight;
    private final double qualityWeight;
    private final Duration halfLife;

    public LexicalReranker(
            @Value("${contextrag.retrieve.rerank.term-weight}") double termWeight,
            @Value("${contextrag.retrieve.rerank.bigram-weight}") double bigramWeight,
            @Value("${contextrag.retrieve.rerank.recency-weight}") double recencyWeight,
            @Value("${contextrag.retrieve.rerank.quality-weight}") double qualityWeight,
            @Value("${contextrag.retrieve.rerank.recency-half-life-days}") long halfLifeDays
    ) {
        if (termWeight < 0 || bigramWeight < 0 || recencyWeight < 0 || qualityWeight < 0
                || termWeight + bigramWeight + recencyWeight + qualityWeight == 0) {
            throw new IllegalArgumentException("rerank weights must be >= 0 and not all zero");
        }
        if (halfLifeDays <= 0) {
            throw new IllegalArgumentException("recency half-life must be > 0 days");
        }
        this.termWeight = termWeight;
        this.bigramWeight = bigramWeight;
        this.recencyWeight = recencyWeight;
        this.qualityWeight = qualityWeight;
        this.halfLife = Duration.ofDays(halfLifeDays);
    }

    @Override
    public List<RetrievedChunk> rerank(String query, List<VectorMatch> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<String> queryTerms = terms(query);
        Set<String> distinctTerms = new LinkedHashSet<>(queryTerms);
        Set<String> queryBigrams = bigrams(queryTerms);

        Instant newest = Instant.EPOCH;
        for (VectorMatch m : candidates) {
            Instant t = modifiedAt(m.metadata());
            if (t.isAfter(newest)) {
                newest = t;
            }
        }

        double totalWeight = termWeight + bigramWeight + recencyWeight + qualityWeight;
        List<RetrievedChunk> out = new ArrayList<>(candidates.size());
        for (VectorMatch m : candidates) {
            List<String> docTerms = terms(document(m));
            Set<String> docTermSet = new HashSet<>(docTerms);

            double termCoverage = coverage(distinctTerms, docTermSet);
            double bigramCoverage = queryBigrams.isEmpty() ? termCoverage : coverage(queryBigrams, bigrams(docTerms));
            double recency = recency(modifiedAt(m.metadata()), newest);
            double quality = quality(m.metadata());

            double score = (termWeight * termCoverage + bigramWeight * bigramCoverage
                    + recencyWeight * recency + qualityWeight * quality) / totalWeight;
            out.add(new RetrievedChunk(m.chunkId(), m.content(), m.metadata(), m.score(), score));
        }
        out.sort(ORDER);

        log.debug("event=rerank_done candidates={} queryTerms={} top={}",
                out.size(), distinctTerms.size(), out.get(0).rerankScore());
        return out;
    }

    private double recency(Instant modifiedAt, Instant newest) {
        if (Instant.EPOCH.equals(modifiedAt)) {
            return 0.0;
        }
        double ageMs = Math.max(0, Duration.between(modifiedAt, newest).toMillis());
        return Math.pow(0.5, ageMs / halfLife.toMillis());
    }

    /**
     * Maps {@code quality_score} from [1, 10] onto [0, 1].
     */
    static double quality(Map<String, Object> metadata) {
        Object v = metadata == null ? null : metadata.get(RecordNormalizer.QUALITY_SCORE);
        double raw;
        if (v instanceof Number n) {
            raw = n.doubleValue();
        } else if (v != null) {
            try {
                raw = Double.parseDouble(String.valueOf(v).trim());
            } catch (NumberFormatException e) {
                return NEUTRAL_QUALITY;
            }
        } else {
            return NEUTRAL_QUALITY;
        }
        double scaled = (raw - 1.0) / (RecordNormalizer.MAX_QUALITY - 1.0);
        return Math.max(0.0, Math.min(1.0, scaled));
    }

    private static String document(VectorMatch m) {
        Object title = m.metadata().get("title");
        String content = m.content() == null ? "" : m.content();
        return title == null ? content : title + " " + content;
    }

    private static double coverage(Set<String> wanted, Set<String> present) {
        if (wanted.isEmpty()) {
            return 0.0;
        }
        int hits = 0;
        for (String w : wanted) {
            if (present.contains(w)) {
                hits++;
            }
        }
        return (double) hits / wanted.size();
    }

    static List<String> terms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String t : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (t.length() >= 2 && !STOPWORDS.contains(t)) {
                out.add(t);
            }
        }
        return out;
    }

    private static Set<String> bigrams(List<String> terms) {
        Set<String> out = new HashSet<>();
        for (int i = 0; i + 1 < terms.size(); i++) {
            out.add(terms.get(i) + " " + terms.get(i + 1));
        }
        return out;
    }

    static Instant modifiedAt(Map<String, Object> metadata) {
        Object v = metadata == null ? null : metadata.get("modified_at");
        if (v == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(String.valueOf(v));
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }
}
