package com.lead.discovery.core.model;

/**
 * Delivery channels for alerts. DASHBOARD is satisfied by persisting the alert.
 */
public enum AlertChannel {
    DASHBOARD,
    EMAIL,
    WEBHOOK;

    public boolean isExternal() {
        return this != DASHBOARD;
    }
}
