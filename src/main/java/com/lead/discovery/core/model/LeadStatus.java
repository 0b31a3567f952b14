package com.lead.discovery.core.model;

/**
 * Lifecycle of a lead. LOST and INVALID are terminal.
 */
public enum LeadStatus {
    NEW,
    CONTACTED,
    INTERESTED,
    CONVERTED,
    LOST,
    INVALID;

    public boolean isTerminal() {
        return this == LOST || this == INVALID;
    }
}
