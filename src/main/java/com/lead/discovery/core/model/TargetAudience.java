package com.lead.discovery.core.model;

/**
 * Audience a service offering is restricted to.
 */
public enum TargetAudience {
    CONSUMER,
    BUSINESS,
    BOTH;

    public boolean accepts(LeadType leadType) {
        if (this == BOTH || leadType == null) {
            return true;
        }
        return (this == CONSUMER && leadType == LeadType.CONSUMER)
                || (this == BUSINESS && leadType == LeadType.BUSINESS);
    }
}
