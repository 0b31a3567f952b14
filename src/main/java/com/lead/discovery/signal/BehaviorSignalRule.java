package com.lead.discovery.signal;

import com.lead.discovery.core.model.Signal;
import com.lead.discovery.core.model.SignalCategory;
import com.lead.discovery.core.model.SignalType;

import java.util.List;

/**
 * Substring markers looked up in the serialized behavior payload. This is a deliberate
 * heuristic over the whole blob, not structured event matching.
 */
public enum BehaviorSignalRule {
    LOAN_CALCULATOR("Used loan calculator", 85, 90, "loan_calculator"),
    APPLICATION_PAGE("Visited application page", 75, 85, "application"),
    RATES_PRICING("Checked rates/pricing", 70, 80, "rate", "pricing", "cost");

    static final String SOURCE = "behavioral_analysis";

    private final String description;
    private final int strength;
    private final int confidence;
    private final List<String> markers;

    BehaviorSignalRule(String description, int strength, int confidence, String... markers) {
        this.description = description;
        this.strength = strength;
        this.confidence = confidence;
        this.markers = List.of(markers);
    }

    /**
     * @param behaviorBlob lower-cased serialized behavior payload
     */
    public boolean matches(String behaviorBlob) {
        return markers.stream().anyMatch(behaviorBlob::contains);
    }

    public Signal toSignal() {
        return new Signal(SignalType.LOAN_NEED, SignalCategory.BEHAVIOR, SOURCE, description, strength, confidence);
    }

    public int strength() {
        return strength;
    }

    public int confidence() {
        return confidence;
    }
}
