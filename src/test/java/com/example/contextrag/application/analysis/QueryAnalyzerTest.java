package com.example.contextrag.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.contextrag.domain.model.ClarificationQuestion;
import com.example.contextrag.domain.model.QueryAnalysis;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryAnalyzerTest {

    private final TopicCatalog catalog = TopicCatalog.defaultCatalog();
    private final QueryAnalyzer analyzer = new QueryAnalyzer(
            new KeywordTopicClassifier(catalog), catalog, new VaguenessDetector());

    @Test
    void vagueJobQuestion_asksForEveryMissingField() {
        QueryAnalysis a = analyzer.analyze("I want a good job", Map.of());

        assertEquals(TopicCatalog.JOBS, a.category());
        assertTrue(a.vague());
        assertTrue(a.needsClarification());
        List<ClarificationQuestion> questions = a.clarificationQuestions();
        assertEquals(2, questions.size());
        assertEquals("job_location", questions.get(0).fieldName());
        assertEquals(List.of("On-campus", "Off-campus", "Both", "Not sure"), questions.get(0).options());
        assertEquals("major", questions.get(1).fieldName());
        assertFalse(questions.get(1).options().isEmpty());

        assertEquals(QueryAnalyzer.MAX_FOLLOW_UPS, a.followUpQuestions().size());
        assertEquals(QueryAnalyzer.MAX_ACTION_ITEMS, a.actionItems().size());
        assertEquals(QueryAnalyzer.MAX_RELATED_TOPICS, a.relatedTopics().size());
    }

    @Test
    void priorAnswers_resolveFieldsAndPersonalize() {
        Map<String, String> prior = new LinkedHashMap<>();
        prior.put("major", "Computer Science");
        prior.put("job_location", " ");

        QueryAnalysis a = analyzer.analyze("I want a good job", prior);

        assertTrue(a.vague());
        assertEquals(1, a.clarificationQuestions().size());
        assertEquals("job_location", a.clarificationQuestions().get(0).fieldName());
        assertFalse(a.followUpQuestions().stream().anyMatch(q -> q.startsWith("What's your major")));
        assertEquals("General Career Fairs", a.relatedTopics().get(0));
    }

    @Test
    void specificQuestion_isNotVague() {
        QueryAnalysis a = analyzer.analyze("Any good on-campus jobs for computer science majors?", Map.of());

        assertEquals(TopicCatalog.JOBS, a.category());
        assertFalse(a.vague());
        assertTrue(a.clarificationQuestions().isEmpty());
        assertFalse(a.needsClarification());
    }

    @Test
    void noVagueTerm_isNotVague() {
        QueryAnalysis a = analyzer.analyze("How do I apply for a job?", Map.of());

        assertFalse(a.vague());
        assertTrue(a.clarificationQuestions().isEmpty());
        assertFalse(a.actionItems().isEmpty());
    }

    @Test
    void unclassifiedQuestion_hasNoEnrichment() {
        QueryAnalysis a = analyzer.analyze("Is the best pizza downtown good?", null);

        assertFalse(a.isClassified());
        assertFalse(a.vague());
        assertEquals(0.0, a.categoryConfidence());
        assertTrue(a.followUpQuestions().isEmpty());
        assertTrue(a.actionItems().isEmpty());
        assertTrue(a.relatedTopics().isEmpty());
    }

    @Test
    void retrievalQuery_appendsPriorAnswers() {
        Map<String, String> prior = new LinkedHashMap<>();
        prior.put("job_location", "On-campus");
        prior.put("major", "Engineering");

        assertEquals("I want a good job\njob location: On-campus\nmajor: Engineering",
                analyzer.retrievalQuery("  I want a good job ", prior));
        assertEquals("I want a good job", analyzer.retrievalQuery("I want a good job", Map.of()));
    }
}
