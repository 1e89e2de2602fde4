package com.example.contextrag.application.analysis;

import com.example.contextrag.domain.model.ClarificationQuestion;
import com.example.contextrag.domain.model.QueryAnalysis;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies a question, decides whether it is too vague to answer precisely and fills in the
 * category's follow-ups, action items and related topics.
 *
 * <p>A question is vague when it contains a generic qualifier and its category still has
 * required fields that neither the prior answers nor the question itself resolve. Vague
 * questions get one clarification question per unresolved field; they are still answered.
 */
@Component
public class QueryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(QueryAnalyzer.class);

    static final int MAX_FOLLOW_UPS = 3;
    static final int MAX_ACTION_ITEMS = 4;
    static final int MAX_RELATED_TOPICS = 5;

    private final TopicClassifier classifier;
    private final TopicCatalog catalog;
    private final VaguenessDetector vaguenessDetector;

    public QueryAnalyzer(TopicClassifier classifier, TopicCatalog catalog, VaguenessDetector vaguenessDetector) {
        this.classifier = classifier;
        this.catalog = catalog;
        this.vaguenessDetector = vaguenessDetector;
    }

    public QueryAnalysis analyze(String question, Map<String, String> priorAnswers) {
        Map<String, String> prior = answered(priorAnswers);
        Classification classification = classifier.classify(question);

        Optional<TopicCategory> category = classification.isClassified()
                ? catalog.find(classification.category())
                : Optional.empty();
        if (category.isEmpty()) {
            log.debug("event=query_unclassified");
            return new QueryAnalysis(QueryAnalysis.UNCLASSIFIED, 0.0, false,
                    List.of(), List.of(), List.of(), List.of());
        }
        TopicCategory topic = category.get();

        Set<String> resolved = new HashSet<>(prior.keySet());
        List<ClarificationField> unresolved = new ArrayList<>();
        for (ClarificationField f : topic.requiredFields()) {
            if (resolved.contains(f.name())) {
                continue;
            }
            if (f.resolvedBy(question)) {
                resolved.add(f.name());
            } else {
                unresolved.add(f);
            }
        }

        List<String> vagueTerms = vaguenessDetector.vagueTerms(question);
        boolean vague = !vagueTerms.isEmpty() && !unresolved.isEmpty();

        List<ClarificationQuestion> clarifications = new ArrayList<>();
        if (vague) {
            for (ClarificationField f : unresolved) {
                clarifications.add(new ClarificationQuestion(f.question(), f.options(), f.context(), f.name()));
            }
        }

        List<String> followUps = new ArrayList<>();
        for (TopicCategory.FollowUp fu : topic.followUps()) {
            if (followUps.size() == MAX_FOLLOW_UPS) {
                break;
            }
            if (fu.field() != null && resolved.contains(fu.field())) {
                continue;
            }
            followUps.add(fu.text());
        }

        List<String> actions = limit(topic.actionItems(), MAX_ACTION_ITEMS);
        List<String> related = limit(personalize(topic.relatedTopics(), prior), MAX_RELATED_TOPICS);

        log.info("event=query_analyzed category={} categoryConfidence={} vague={} vagueTerms={} unresolved={} priorAnswers={}",
                topic.name(), classification.confidence(), vague, vagueTerms, unresolved.size(), prior.size());

        return new QueryAnalysis(topic.name(), classification.confidence(), vague,
                clarifications, followUps, actions, related);
    }

    /**
     * Question text used for retrieval: the question followed by the user's prior answers.
     */
    public String retrievalQuery(String question, Map<String, String> priorAnswers) {
        Map<String, String> prior = answered(priorAnswers);
        if (prior.isEmpty()) {
            return question.trim();
        }
        StringBuilder sb = new StringBuilder(question.trim());
        for (Map.Entry<String, String> e : prior.entrySet()) {
            sb.append('\n').append(e.getKey().replace('_', ' ')).append(": ").append(e.getValue().trim());
        }
        return sb.toString();
    }

    /**
     * Topics mentioning the user's major move to the front; nothing is dropped.
     */
    private static List<String> personalize(List<String> topics, Map<String, String> prior) {
        String major = prior.get("major");
        if (major == null) {
            return topics;
        }
        String needle = major.toLowerCase(Locale.ROOT);
        List<String> first = new ArrayList<>();
        List<String> rest = new ArrayList<>();
        for (String t : topics) {
            String lower = t.toLowerCase(Locale.ROOT);
            if (lower.contains(needle) || lower.contains("general")) {
                first.add(t);
            } else {
                rest.add(t);
            }
        }
        first.addAll(rest);
        return first;
    }

    private static Map<String, String> answered(Map<String, String> priorAnswers) {
        if (priorAnswers == null || priorAnswers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : priorAnswers.entrySet()) {
            if (e.getKey() != null && e.getValue() != null && !e.getValue().isBlank()) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    private static List<String> limit(List<String> items, int max) {
        return items.size() <= max ? items : items.subList(0, max);
    }
}
