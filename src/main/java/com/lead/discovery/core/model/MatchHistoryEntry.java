package com.lead.discovery.core.model;

import java.time.Instant;

/**
 * One status change recorded against a match.
 */
public record MatchHistoryEntry(MatchStatus status, String notes, Instant at) {

    public String eventType() {
        return "status_changed_" + status.code();
    }
}
