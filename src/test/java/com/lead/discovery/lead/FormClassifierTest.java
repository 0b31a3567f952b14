package com.lead.discovery.lead;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormClassifierTest {

    private final FormClassifier classifier = new FormClassifier();

    @Test
    void firstMatchingRuleWins() {
        assertEquals(FormType.CONTACT, classifier.classify(List.of("name", "email")));
        assertEquals(FormType.CONTACT, classifier.classify(List.of("email", "phone", "company")));
        assertEquals(FormType.QUOTE, classifier.classify(List.of("budget", "email")));
        assertEquals(FormType.APPLICATION, classifier.classify(List.of("loan", "amount")));
        assertEquals(FormType.NEWSLETTER, classifier.classify(List.of(" Email ")));
        assertEquals(FormType.LEAD_CAPTURE, classifier.classify(List.of("zip")));
        assertEquals(FormType.LEAD_CAPTURE, classifier.classify(List.of()));
    }

    @Test
    void analyzeCountsEveryType() {
        Map<FormType, Integer> counts = classifier.analyze(List.of(
                List.of("email"),
                List.of("email", "first"),
                List.of("project")));

        assertEquals(FormType.values().length, counts.size());
        assertEquals(2, counts.get(FormType.NEWSLETTER));
        assertEquals(1, counts.get(FormType.QUOTE));
        assertEquals(0, counts.get(FormType.CONTACT));
    }
}
