package com.lead.discovery.core.model;

import java.util.Locale;

/**
 * Externally managed follow-up status of a match. Never overwritten by a re-score.
 */
public enum MatchStatus {
    PENDING,
    CONTACTED,
    INTERESTED,
    CONVERTED,
    REJECTED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
