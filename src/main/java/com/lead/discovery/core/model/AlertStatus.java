package com.lead.discovery.core.model;

/**
 * Alert lifecycle: NEW to READ to ACTIONED, or NEW to DISMISSED.
 * ACTIONED and DISMISSED are terminal and nothing returns to NEW.
 */
public enum AlertStatus {
    NEW,
    READ,
    ACTIONED,
    DISMISSED;

    public boolean isTerminal() {
        return this == ACTIONED || this == DISMISSED;
    }

    public boolean canTransitionTo(AlertStatus next) {
        return switch (this) {
            case NEW -> next == READ || next == DISMISSED;
            case READ -> next == ACTIONED;
            case ACTIONED, DISMISSED -> false;
        };
    }
}
