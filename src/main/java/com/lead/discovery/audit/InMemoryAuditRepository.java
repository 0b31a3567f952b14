package com.lead.discovery.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link AuditRepository}.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findBySubjectId(String subjectId) {
        return entries.stream()
                .filter(e -> subjectId.equals(e.subjectId()))
                .toList();
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return entries.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> snapshot = new ArrayList<>(entries);
        int size = snapshot.size();
        return List.copyOf(snapshot.subList(Math.max(0, size - limit), size));
    }

    @Override
    public int count() {
        return entries.size();
    }

    @Override
    public long deleteBefore(Instant cutoff) {
        List<AuditEntry> expired = entries.stream()
                .filter(e -> e.timestamp().isBefore(cutoff))
                .toList();
        entries.removeAll(expired);
        return expired.size();
    }
}
