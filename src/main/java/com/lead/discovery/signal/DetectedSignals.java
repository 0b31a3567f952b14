package com.lead.discovery.signal;

import com.lead.discovery.core.model.Signal;
import com.lead.discovery.core.model.SignalType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Signals of one detection run grouped by type. Every type is present, possibly empty.
 */
public final class DetectedSignals {

    private final Map<SignalType, List<Signal>> byType;

    DetectedSignals(List<Signal> signals) {
        Map<SignalType, List<Signal>> grouped = new EnumMap<>(SignalType.class);
        for (SignalType type : SignalType.values()) {
            grouped.put(type, new ArrayList<>());
        }
        signals.forEach(s -> grouped.get(s.type()).add(s));
        grouped.replaceAll((type, list) -> List.copyOf(list));
        this.byType = Collections.unmodifiableMap(grouped);
    }

    public List<Signal> ofType(SignalType type) {
        return byType.get(type);
    }

    public Map<SignalType, List<Signal>> asMap() {
        return byType;
    }

    /**
     * All signals in type order, then detection order.
     */
    public List<Signal> all() {
        List<Signal> all = new ArrayList<>();
        byType.values().forEach(all::addAll);
        return all;
    }

    public int count() {
        return byType.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return count() == 0;
    }
}
