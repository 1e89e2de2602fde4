package com.example.contextrag.application.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Regex keyword table. A category scores one hit per distinct pattern found in the question;
 * the highest score wins and earlier catalog entries win ties.
 */
@Component
public class KeywordTopicClassifier implements TopicClassifier {

    private static final Logger log = LoggerFactory.getLogger(KeywordTopicClassifier.class);

    private static final double SINGLE_HIT = 0.6;
    private static final double PER_EXTRA_HIT = 0.15;
    private static final double MAX_CONFIDENCE = 0.95;
    private static final double AMBIGUITY_PENALTY = 0.2;

    private final TopicCatalog catalog;

    public KeywordTopicClassifier(TopicCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Classification classify(String question) {
        if (question == null || question.isBlank()) {
            return Classification.unclassified();
        }

        TopicCategory best = null;
        List<String> bestMatched = List.of();
        int runnerUp = 0;

        for (TopicCategory category : catalog.categories()) {
            List<String> matched = new ArrayList<>();
            for (Pattern p : category.patterns()) {
                Matcher m = p.matcher(question);
                if (m.find()) {
                    matched.add(m.group().toLowerCase(Locale.ROOT));
                }
            }
            if (matched.size() > bestMatched.size()) {
                runnerUp = bestMatched.size();
                best = category;
                bestMatched = matched;
            } else if (matched.size() > runnerUp) {
                runnerUp = matched.size();
            }
        }

        if (best == null) {
            return Classification.unclassified();
        }

        int hits = bestMatched.size();
        double confidence = Math.min(MAX_CONFIDENCE, SINGLE_HIT + PER_EXTRA_HIT * (hits - 1));
        if (runnerUp == hits) {
            confidence -= AMBIGUITY_PENALTY;
        }

        log.debug("event=topic_classified category={} hits={} runnerUp={} confidence={}",
                best.name(), hits, runnerUp, confidence);
        return new Classification(best.name(), confidence, bestMatched);
    }
}
