package com.lead.discovery.audit;

/**
 * Auditable actions across identity, matching and alerting.
 */
public enum AuditAction {
    IDENTIFIER_ANONYMIZED,
    IDENTIFIER_DELETED,
    IDENTIFIERS_LINKED,
    PROFILE_CREATED,
    PROFILE_MERGED,
    LEAD_CREATED,
    LEAD_ENRICHED,
    LEAD_STATUS_CHANGED,
    MATCH_STATUS_CHANGED,
    ALERT_RULE_CREATED,
    ALERT_STATUS_CHANGED,
    RETENTION_APPLIED
}
