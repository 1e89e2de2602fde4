package com.example.contextrag.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class VaguenessDetectorTest {

    private final VaguenessDetector detector = new VaguenessDetector();

    @Test
    void findsGenericQualifiersOnce() {
        assertEquals(List.of("best", "easy"), detector.vagueTerms("Best easy classes? The BEST ones."));
    }

    @Test
    void matchesWholeWordsOnly() {
        assertFalse(detector.hasVagueTerm("Goodwill store hours near Tempe"));
        assertFalse(detector.hasVagueTerm("Is CSE 340 hardware heavy?"));
    }

    @Test
    void termsAreLowercasedIndependentlyOfDefaultLocale() {
        Locale before = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(List.of("things"), detector.vagueTerms("THINGS TO DO"));
        } finally {
            Locale.setDefault(before);
        }
    }

    @Test
    void multiWordTerm() {
        assertTrue(detector.vagueTerms("parking, housing and so on").contains("and so on"));
    }

    @Test
    void blankQuestion_hasNoTerms() {
        assertTrue(detector.vagueTerms("  ").isEmpty());
        assertTrue(detector.vagueTerms(null).isEmpty());
    }
}
