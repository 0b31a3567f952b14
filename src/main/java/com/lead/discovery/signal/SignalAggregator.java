package com.lead.discovery.signal;

import com.lead.discovery.core.model.Signal;
import com.lead.discovery.core.model.SignalType;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Folds a lead's signals into its aggregate strength, intent score and need labels.
 */
public final class SignalAggregator {

    static final int MAX_CORROBORATION_BONUS = 20;
    static final int BONUS_PER_SIGNAL = 5;

    private SignalAggregator() {
    }

    /**
     * Mean strength plus {@code min(20, 5 * count)} when more than one signal corroborates,
     * capped at 100. No signals gives 0.
     */
    public static int aggregateStrength(Collection<Signal> signals) {
        if (signals == null || signals.isEmpty()) {
            return 0;
        }
        double average = signals.stream().mapToInt(Signal::strength).average().orElse(0);
        if (signals.size() > 1) {
            average = Math.min(100, average + Math.min(MAX_CORROBORATION_BONUS, signals.size() * BONUS_PER_SIGNAL));
        }
        return (int) average;
    }

    /**
     * Strength weighted by type multiplier, summed and normalized against the largest possible
     * sum ({@code count * 100 * 1.8}).
     */
    public static int intentScore(Collection<Signal> signals) {
        if (signals == null || signals.isEmpty()) {
            return 0;
        }
        double weighted = signals.stream()
                .mapToDouble(s -> s.strength() * s.type().intentMultiplier())
                .sum();
        double max = signals.size() * 100 * SignalType.MAX_MULTIPLIER;
        return (int) Math.min(100, weighted / max * 100);
    }

    /**
     * Need labels implied by the distinct signal types present.
     */
    public static Set<String> needsIdentified(Collection<Signal> signals) {
        Set<String> needs = new TreeSet<>();
        if (signals != null) {
            signals.forEach(s -> needs.add(s.type().needLabel()));
        }
        return needs;
    }
}
