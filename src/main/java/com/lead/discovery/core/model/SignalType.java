package com.lead.discovery.core.model;

import java.util.Locale;

/**
 * Typed intent signals. Each type carries the multiplier used by the intent score
 * and the need label it implies.
 */
public enum SignalType {
    LOAN_NEED(1.5, "business_loan"),
    CONSULTING_NEED(1.3, "business_consulting"),
    FINANCIAL_DISTRESS(1.8, "financial_assistance"),
    GROWTH(1.2, "growth_capital"),
    EXPANSION(1.4, "expansion_financing");

    /** Largest multiplier of any type, used to normalize intent into [0,100]. */
    public static final double MAX_MULTIPLIER = 1.8;

    private final double intentMultiplier;
    private final String needLabel;

    SignalType(double intentMultiplier, String needLabel) {
        this.intentMultiplier = intentMultiplier;
        this.needLabel = needLabel;
    }

    public double intentMultiplier() {
        return intentMultiplier;
    }

    public String needLabel() {
        return needLabel;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
