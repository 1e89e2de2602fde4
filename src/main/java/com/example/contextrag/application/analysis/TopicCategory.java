package com.example.contextrag.application.analysis;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One entry of the topic catalog: trigger patterns, the fields a precise answer needs and the
 * enrichment templates shown alongside answers.
 */
public record TopicCategory(
        String name,
        List<Pattern> patterns,
        List<ClarificationField> requiredFields,
        List<FollowUp> followUps,
        List<String> actionItems,
        List<String> relatedTopics
) {
    /**
     * @param field name of the clarification field this follow-up asks about, or null
     */
    public record FollowUp(String text, String field) {

        public static FollowUp general(String text) {
            return new FollowUp(text, null);
        }

        public static FollowUp about(String field, String text) {
            return new FollowUp(text, field);
        }
    }

    public TopicCategory {
        patterns = List.copyOf(patterns);
        requiredFields = List.copyOf(requiredFields);
        followUps = List.copyOf(followUps);
        actionItems = List.copyOf(actionItems);
        relatedTopics = List.copyOf(relatedTopics);
    }

    public static List<Pattern> words(String... regexes) {
        Pattern[] out = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            out[i] = Pattern.compile("\\b(?:" + regexes[i] + ")\\b", Pattern.CASE_INSENSITIVE);
        }
        return List.of(out);
    }
}
