package com.example.contextrag.application.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds generic qualifiers ("good", "best", "stuff") that leave a question open to several readings.
 * Terms match as whole words only, so "goodwill" is not vague.
 */
@Component
public class VaguenessDetector {

    static final List<String> VAGUE_TERMS = List.of(
            "good", "best", "easy", "hard", "nice", "bad", "better",
            "some", "any", "things", "stuff", "etc", "and so on"
    );

    private static final Pattern VAGUE = Pattern.compile(
            "\\b(" + String.join("|", VAGUE_TERMS) + ")\\b", Pattern.CASE_INSENSITIVE);

    public List<String> vagueTerms(String question) {
        if (question == null || question.isBlank()) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        Matcher m = VAGUE.matcher(question);
        while (m.find()) {
            String term = m.group(1).toLowerCase(Locale.ROOT);
            if (!found.contains(term)) {
                found.add(term);
            }
        }
        return found;
    }

    public boolean hasVagueTerm(String question) {
        return !vagueTerms(question).isEmpty();
    }
}
