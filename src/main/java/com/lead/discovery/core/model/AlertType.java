package com.lead.discovery.core.model;

import java.util.Locale;

/**
 * Alert categories. Rules are selected by matching their type against the alert's type.
 */
public enum AlertType {
    NEW_LEAD,
    HIGH_SCORE_MATCH,
    GEOGRAPHIC,
    INDUSTRY,
    BEHAVIOR_CHANGE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertType fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
