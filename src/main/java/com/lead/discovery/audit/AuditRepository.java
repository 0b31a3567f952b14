package com.lead.discovery.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only storage for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findBetween(Instant start, Instant end);

    /**
     * Most recent entries, oldest first.
     */
    List<AuditEntry> findRecent(int limit);

    int count();

    /**
     * Removes entries recorded before the cutoff.
     *
     * @return number of entries removed
     */
    long deleteBefore(Instant cutoff);
}
