package com.lead.discovery.identity;

import com.lead.discovery.core.model.IdentifierType;

import java.util.Map;

/**
 * Aggregate view over the identifier store.
 */
public record IdentifierStats(
        long totalIdentifiers,
        int distinctTypes,
        long linkedProfiles,
        long unlinkedIdentifiers,
        double averageSeenCount,
        Map<IdentifierType, Long> countsByType
) {
    public IdentifierStats {
        countsByType = countsByType != null ? Map.copyOf(countsByType) : Map.of();
    }

    public static IdentifierStats empty() {
        return new IdentifierStats(0, 0, 0, 0, 0.0, Map.of());
    }
}
