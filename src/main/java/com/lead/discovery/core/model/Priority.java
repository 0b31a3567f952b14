package com.lead.discovery.core.model;

/**
 * Priority shared by matches, alert rules and alerts.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
