package com.lead.discovery.audit;

import com.lead.discovery.graph.GraphConnection;
import com.lead.discovery.graph.GraphRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed {@link AuditRepository}. Entries are {@code :AuditEntry} nodes
 * with details stored as a JSON string.
 */
public class GraphAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphAuditRepository.class);

    private static final String RETURN_COLUMNS = """
            RETURN a.id as id, a.action as action, a.subjectId as subjectId,
                   a.actorId as actorId, a.details as details, a.timestamp as timestamp
            """;

    private final GraphConnection connection;

    public GraphAuditRepository(GraphConnection connection) {
        this.connection = connection;
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.subjectId)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.timestamp)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("audit.index query={} result={}", query, e.getMessage());
        }
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        connection.execute("""
                CREATE (a:AuditEntry {
                    id: $id,
                    action: $action,
                    subjectId: $subjectId,
                    actorId: $actorId,
                    details: $details,
                    timestamp: $timestamp
                })
                """, Map.of(
                "id", entry.id(),
                "action", entry.action().name(),
                "subjectId", GraphRows.orEmpty(entry.subjectId()),
                "actorId", GraphRows.orEmpty(entry.actorId()),
                "details", GraphRows.toJson(entry.details()),
                "timestamp", GraphRows.timestamp(entry.timestamp())
        ));
        log.debug("audit.persisted action={} subjectId={}", entry.action(), entry.subjectId());
        return entry;
    }

    @Override
    public List<AuditEntry> findBySubjectId(String subjectId) {
        return map(connection.query("MATCH (a:AuditEntry {subjectId: $subjectId})\n" + RETURN_COLUMNS
                + "ORDER BY a.timestamp ASC", Map.of("subjectId", subjectId)));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return map(connection.query("MATCH (a:AuditEntry {action: $action})\n" + RETURN_COLUMNS
                + "ORDER BY a.timestamp ASC", Map.of("action", action.name())));
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return map(connection.query("MATCH (a:AuditEntry)\nWHERE a.timestamp >= $start AND a.timestamp <= $end\n"
                + RETURN_COLUMNS + "ORDER BY a.timestamp ASC",
                Map.of("start", GraphRows.timestamp(start), "end", GraphRows.timestamp(end))));
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> newestFirst = map(connection.query("MATCH (a:AuditEntry)\n" + RETURN_COLUMNS
                + "ORDER BY a.timestamp DESC\nLIMIT $limit", Map.of("limit", limit)));
        List<AuditEntry> result = new ArrayList<>(newestFirst);
        Collections.reverse(result);
        return result;
    }

    @Override
    public int count() {
        List<Map<String, Object>> rows = connection.query("MATCH (a:AuditEntry) RETURN count(a) as cnt");
        return rows.isEmpty() ? 0 : (int) GraphRows.longValue(rows.get(0), "cnt");
    }

    @Override
    public long deleteBefore(Instant cutoff) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (a:AuditEntry)
                WHERE a.timestamp < $cutoff
                DELETE a
                RETURN count(a) as deleted
                """, Map.of("cutoff", GraphRows.timestamp(cutoff)));
        return rows.isEmpty() ? 0 : GraphRows.longValue(rows.get(0), "deleted");
    }

    private List<AuditEntry> map(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toEntry).toList();
    }

    private AuditEntry toEntry(Map<String, Object> row) {
        Instant timestamp = GraphRows.instant(row, "timestamp");
        return new AuditEntry(
                GraphRows.string(row, "id"),
                AuditAction.valueOf(GraphRows.string(row, "action")),
                GraphRows.string(row, "subjectId"),
                GraphRows.string(row, "actorId"),
                GraphRows.mapFromJson(GraphRows.string(row, "details")),
                timestamp != null ? timestamp : Instant.now());
    }
}
