package com.lead.discovery.signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lead.discovery.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts typed intent {@link Signal}s from page text and behavior payloads.
 *
 * <p>Every {@link SignalPatternLibrary} runs independently over the text; each match
 * is one signal. Behavior payloads are serialized to JSON and checked for the
 * {@link BehaviorSignalRule} markers.</p>
 */
public class SignalDetector {
    private static final Logger log = LoggerFactory.getLogger(SignalDetector.class);

    static final String CONTENT_SOURCE = "content_analysis";
    static final int BASE_STRENGTH = 60;

    private static final List<String> URGENCY_TERMS = List.of("urgent", "immediately", "asap", "quickly", "now", "today");
    private static final Pattern CURRENCY = Pattern.compile("\\$\\d+[,\\d]*");
    private static final Pattern PHONE = Pattern.compile("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private final ObjectMapper objectMapper;

    public SignalDetector() {
        this(new ObjectMapper());
    }

    public SignalDetector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * All signals in the text and behavior, grouped by type.
     */
    public DetectedSignals detectAll(String content, Map<String, Object> behavior) {
        return new DetectedSignals(detect(content, behavior));
    }

    public List<Signal> detect(String content, Map<String, Object> behavior) {
        List<Signal> keywords = detectKeywords(content);
        List<Signal> behavioral = detectBehavior(behavior);
        List<Signal> signals = new ArrayList<>(keywords);
        signals.addAll(behavioral);
        log.debug("signal.detected keyword={} behavior={}", keywords.size(), behavioral.size());
        return signals;
    }

    public List<Signal> detectKeywords(String content) {
        List<Signal> signals = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return signals;
        }
        for (SignalPatternLibrary library : SignalPatternLibrary.values()) {
            signals.addAll(scan(library, content));
        }
        return signals;
    }

    public List<Signal> scan(SignalPatternLibrary library, String content) {
        List<Signal> signals = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return signals;
        }
        int strength = library.strengthFor(content);
        for (Pattern pattern : library.patterns()) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                signals.add(new Signal(library.signalType(), library.category(), CONTENT_SOURCE,
                        matcher.group(), strength, library.confidence()));
            }
        }
        return signals;
    }

    /**
     * Behavioral signals from the serialized payload. An empty or unserializable payload
     * yields none.
     */
    public List<Signal> detectBehavior(Map<String, Object> behavior) {
        List<Signal> signals = new ArrayList<>();
        if (behavior == null || behavior.isEmpty()) {
            return signals;
        }
        String blob;
        try {
            blob = objectMapper.writeValueAsString(behavior).toLowerCase(Locale.ROOT);
        } catch (JsonProcessingException e) {
            log.warn("signal.behavior.unreadable error={}", e.getMessage());
            return signals;
        }
        for (BehaviorSignalRule rule : BehaviorSignalRule.values()) {
            if (rule.matches(blob)) {
                signals.add(rule.toSignal());
            }
        }
        return signals;
    }

    /**
     * Base 60, +15 for an urgency term, +10 for a currency amount, +10 each for a phone
     * number and an email address, capped at 100.
     */
    static int keywordStrength(String content) {
        int strength = BASE_STRENGTH;
        String lower = content.toLowerCase(Locale.ROOT);
        if (URGENCY_TERMS.stream().anyMatch(lower::contains)) {
            strength += 15;
        }
        if (CURRENCY.matcher(content).find()) {
            strength += 10;
        }
        if (PHONE.matcher(content).find()) {
            strength += 10;
        }
        if (EMAIL.matcher(content).find()) {
            strength += 10;
        }
        return Math.min(100, strength);
    }
}
