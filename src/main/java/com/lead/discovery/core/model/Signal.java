package com.lead.discovery.core.model;

import java.util.Objects;

/**
 * Immutable piece of keyword or behavioral evidence that a lead has a need.
 *
 * @param type       the need the evidence points to
 * @param category   how it was detected
 * @param source     where it came from (pattern text, behavior marker, page)
 * @param content    matched snippet
 * @param strength   strength in [0,100]
 * @param confidence confidence in [0,100]
 */
public record Signal(
        SignalType type,
        SignalCategory category,
        String source,
        String content,
        int strength,
        int confidence
) {
    public Signal {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(category, "category is required");
        if (strength < 0 || strength > 100) {
            throw new IllegalArgumentException("strength must be in [0,100]: " + strength);
        }
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be in [0,100]: " + confidence);
        }
    }
}
