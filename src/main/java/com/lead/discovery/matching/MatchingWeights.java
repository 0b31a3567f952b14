package com.lead.discovery.matching;

/**
 * Weights of the five match components. Must be non-negative and sum to 1.0.
 */
public record MatchingWeights(
        double geographic,
        double industry,
        double need,
        double profile,
        double behavioral
) {
    public MatchingWeights {
        if (geographic < 0 || industry < 0 || need < 0 || profile < 0 || behavioral < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = geographic + industry + need + profile + behavioral;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 25% geographic, 20% industry, 25% need, 15% profile, 15% behavioral.
     */
    public static MatchingWeights defaultWeights() {
        return new MatchingWeights(0.25, 0.20, 0.25, 0.15, 0.15);
    }

    /**
     * Weights for services sold purely on need, where location barely matters.
     */
    public static MatchingWeights needFocused() {
        return new MatchingWeights(0.10, 0.15, 0.40, 0.15, 0.20);
    }
}
