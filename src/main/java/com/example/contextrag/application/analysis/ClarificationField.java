package com.example.contextrag.application.analysis;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A detail a category needs before it can be answered precisely. The field counts as resolved
 * when the user already supplied it as a prior answer or the question matches one of the
 * specific indicators.
 */
public record ClarificationField(
        String name,
        String question,
        List<String> options,
        String context,
        List<Pattern> specificIndicators
) {
    public ClarificationField {
        options = List.copyOf(options);
        specificIndicators = List.copyOf(specificIndicators);
    }

    public static ClarificationField of(String name, String question, String context,
                                        List<String> options, String... indicatorRegexes) {
        Pattern[] patterns = new Pattern[indicatorRegexes.length];
        for (int i = 0; i < indicatorRegexes.length; i++) {
            patterns[i] = Pattern.compile(indicatorRegexes[i], Pattern.CASE_INSENSITIVE);
        }
        return new ClarificationField(name, question, options, context, List.of(patterns));
    }

    public boolean resolvedBy(String question) {
        String q = question == null ? "" : question.toLowerCase(Locale.ROOT);
        for (Pattern p : specificIndicators) {
            if (p.matcher(q).find()) {
                return true;
            }
        }
        return false;
    }
}
