package com.lead.discovery.signal;

import com.lead.discovery.core.model.Signal;
import com.lead.discovery.core.model.SignalCategory;
import com.lead.discovery.core.model.SignalType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalDetectorTest {

    private final SignalDetector detector = new SignalDetector();

    @Nested
    @DisplayName("Keyword libraries")
    class Keywords {

        @Test
        @DisplayName("Loan request with urgency and an amount is scored from context")
        void contextualLoanSignal() {
            List<Signal> signals = detector.detectKeywords("We need a business loan urgently, about $50,000.");

            assertEquals(1, signals.size());
            Signal signal = signals.get(0);
            assertEquals(SignalType.LOAN_NEED, signal.type());
            assertEquals(SignalCategory.KEYWORD, signal.category());
            assertEquals(SignalDetector.CONTENT_SOURCE, signal.source());
            assertEquals("need a business loan", signal.content());
            assertEquals(85, signal.strength());
            assertEquals(80, signal.confidence());
        }

        @Test
        @DisplayName("Libraries run independently over the same text")
        void overlappingLibraries() {
            DetectedSignals detected = detector.detectAll("Our cash flow problem is getting worse", Map.of());

            assertEquals(1, detected.ofType(SignalType.LOAN_NEED).size());
            assertEquals(1, detected.ofType(SignalType.FINANCIAL_DISTRESS).size());
            assertEquals(90, detected.ofType(SignalType.FINANCIAL_DISTRESS).get(0).strength());
            assertEquals(2, detected.count());
        }

        @Test
        void fixedStrengthLibraries() {
            DetectedSignals detected = detector.detectAll("Announcing our acquisition of a rival", null);

            List<Signal> expansion = detected.ofType(SignalType.EXPANSION);
            assertEquals(1, expansion.size());
            assertEquals(80, expansion.get(0).strength());
            assertEquals(80, expansion.get(0).confidence());
        }

        @Test
        void problemIndicators() {
            List<Signal> signals = detector.scan(SignalPatternLibrary.CONSULTING_PROBLEMS,
                    "We are struggling with inventory");

            assertEquals(1, signals.size());
            assertEquals(SignalCategory.PROBLEM_INDICATOR, signals.get(0).category());
            assertEquals(SignalType.CONSULTING_NEED, signals.get(0).type());
            assertEquals(65, signals.get(0).strength());
        }

        @Test
        void noMatches_noSignals() {
            DetectedSignals detected = detector.detectAll("The weather is lovely", Map.of());
            assertTrue(detected.isEmpty());
            assertTrue(detected.ofType(SignalType.GROWTH).isEmpty());
            assertTrue(detector.detectKeywords(null).isEmpty());
        }

        @Test
        void keywordStrengthIsCapped() {
            assertEquals(60, SignalDetector.keywordStrength("plain text"));
            assertEquals(100, SignalDetector.keywordStrength("urgent: $5,000, call 555-123-4567 or a@b.io"));
        }
    }

    @Nested
    @DisplayName("Behavior payloads")
    class Behavior {

        @Test
        void loanCalculatorMarker() {
            List<Signal> signals = detector.detectBehavior(Map.of("page", "loan_calculator"));

            assertEquals(1, signals.size());
            assertEquals(SignalCategory.BEHAVIOR, signals.get(0).category());
            assertEquals(85, signals.get(0).strength());
            assertEquals(90, signals.get(0).confidence());
        }

        @Test
        void nestedMarkersAreFound() {
            Map<String, Object> behavior = Map.of(
                    "events", List.of(Map.of("path", "/apply/Application-Form"), Map.of("viewed", "PRICING")));

            List<Signal> signals = detector.detectBehavior(behavior);

            assertEquals(2, signals.size());
            assertTrue(signals.stream().allMatch(s -> s.type() == SignalType.LOAN_NEED));
        }

        @Test
        void emptyPayload_noSignals() {
            assertTrue(detector.detectBehavior(Map.of()).isEmpty());
            assertTrue(detector.detectBehavior(null).isEmpty());
        }
    }
}
