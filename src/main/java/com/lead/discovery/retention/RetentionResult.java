package com.lead.discovery.retention;

/**
 * Result of a retention sweep.
 *
 * @param identifierRetentionDays the retention the identifier sweep ran with
 * @param identifiersDeleted      number of unlinked identifiers deleted
 * @param alertsDeleted           number of resolved alerts deleted
 * @param auditEntriesDeleted     number of audit entries deleted
 */
public record RetentionResult(
        int identifierRetentionDays,
        long identifiersDeleted,
        long alertsDeleted,
        long auditEntriesDeleted
) {
    public long totalDeleted() {
        return identifiersDeleted + alertsDeleted + auditEntriesDeleted;
    }

    public static RetentionResult empty() {
        return new RetentionResult(0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return "RetentionResult{identifiers=" + identifiersDeleted +
                ", alerts=" + alertsDeleted +
                ", audit=" + auditEntriesDeleted +
                ", total=" + totalDeleted() + '}';
    }
}
