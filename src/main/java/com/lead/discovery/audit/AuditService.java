package com.lead.discovery.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Records and queries the audit trail.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "SYSTEM";

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        AuditEntry entry = repository.save(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .build());
        log.debug("audit.recorded action={} subjectId={} actor={}", action, subjectId, actorId);
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, Map<String, Object> details) {
        return record(action, subjectId, SYSTEM_ACTOR, details);
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return repository.findBetween(start, end);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }

    public long purgeBefore(Instant cutoff) {
        return repository.deleteBefore(cutoff);
    }

    public AuditRepository getRepository() {
        return repository;
    }
}
