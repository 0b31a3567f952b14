package com.lead.discovery.alert;

import com.lead.discovery.core.model.Alert;
import com.lead.discovery.core.model.AlertStatus;
import com.lead.discovery.core.model.AlertType;
import com.lead.discovery.core.model.Priority;
import com.lead.discovery.graph.GraphConnection;
import com.lead.discovery.graph.GraphRows;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed {@link AlertRepository}. Alert data is stored as a JSON string and
 * linked rule ids as a list property.
 */
public class GraphAlertRepository implements AlertRepository {

    private static final String RETURN_COLUMNS = """
            RETURN a.id as id, a.leadId as leadId, a.alertType as alertType, a.title as title,
                   a.message as message, a.priority as priority, a.data as data, a.status as status,
                   a.ruleIds as ruleIds, a.createdAt as createdAt, a.readAt as readAt,
                   a.actionedAt as actionedAt, a.dismissedAt as dismissedAt
            """;

    private final GraphConnection connection;

    public GraphAlertRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Alert save(Alert alert) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", alert.getId());
        params.put("leadId", GraphRows.orEmpty(alert.getLeadId()));
        params.put("alertType", alert.getAlertType().name());
        params.put("title", alert.getTitle());
        params.put("message", GraphRows.orEmpty(alert.getMessage()));
        params.put("priority", alert.getPriority().name());
        params.put("data", GraphRows.toJson(alert.getData()));
        params.put("status", alert.getStatus().name());
        params.put("ruleIds", List.copyOf(alert.getRuleIds()));
        params.put("createdAt", GraphRows.timestamp(alert.getCreatedAt()));
        params.put("readAt", GraphRows.orEmpty(alert.getReadAt()));
        params.put("actionedAt", GraphRows.orEmpty(alert.getActionedAt()));
        params.put("dismissedAt", GraphRows.orEmpty(alert.getDismissedAt()));
        connection.execute("""
                MERGE (a:Alert {id: $id})
                SET a.leadId = $leadId, a.alertType = $alertType, a.title = $title, a.message = $message,
                    a.priority = $priority, a.data = $data, a.status = $status, a.ruleIds = $ruleIds,
                    a.createdAt = $createdAt, a.readAt = $readAt, a.actionedAt = $actionedAt,
                    a.dismissedAt = $dismissedAt
                """, params);
        return alert;
    }

    @Override
    public Optional<Alert> findById(String id) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (a:Alert {id: $id})\n" + RETURN_COLUMNS, Map.of("id", id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(toAlert(rows.get(0)));
    }

    @Override
    public List<Alert> find(AlertFilter filter) {
        List<String> clauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        if (filter.getStatus() != null) {
            clauses.add("a.status = $status");
            params.put("status", filter.getStatus().name());
        }
        if (filter.getAlertType() != null) {
            clauses.add("a.alertType = $alertType");
            params.put("alertType", filter.getAlertType().name());
        }
        if (filter.getPriority() != null) {
            clauses.add("a.priority = $priority");
            params.put("priority", filter.getPriority().name());
        }
        params.put("limit", filter.getLimit());
        String where = clauses.isEmpty() ? "" : "WHERE " + String.join(" AND ", clauses) + "\n";
        return toAlerts(connection.query("MATCH (a:Alert)\n" + where + RETURN_COLUMNS
                + "ORDER BY createdAt DESC LIMIT $limit", params));
    }

    @Override
    public List<Alert> findCreatedSince(Instant since) {
        return toAlerts(connection.query("""
                MATCH (a:Alert)
                WHERE a.createdAt > $since
                """ + RETURN_COLUMNS + "ORDER BY createdAt DESC",
                Map.of("since", GraphRows.timestamp(since))));
    }

    @Override
    public int deleteResolvedBefore(Instant cutoff) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (a:Alert)
                WHERE a.status IN ['ACTIONED', 'DISMISSED'] AND a.createdAt < $cutoff
                DELETE a
                RETURN count(a) as deleted
                """, Map.of("cutoff", GraphRows.timestamp(cutoff)));
        return rows.isEmpty() ? 0 : (int) GraphRows.longValue(rows.get(0), "deleted");
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = connection.query("MATCH (a:Alert) RETURN count(a) as cnt");
        return rows.isEmpty() ? 0 : GraphRows.longValue(rows.get(0), "cnt");
    }

    private List<Alert> toAlerts(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toAlert).toList();
    }

    private Alert toAlert(Map<String, Object> row) {
        return Alert.builder()
                .id(GraphRows.string(row, "id"))
                .leadId(GraphRows.string(row, "leadId"))
                .alertType(AlertType.valueOf(GraphRows.string(row, "alertType")))
                .title(GraphRows.string(row, "title"))
                .message(GraphRows.string(row, "message"))
                .priority(Priority.valueOf(GraphRows.string(row, "priority")))
                .data(GraphRows.mapFromJson(GraphRows.string(row, "data")))
                .status(AlertStatus.valueOf(GraphRows.string(row, "status")))
                .ruleIds(GraphRows.stringSet(row, "ruleIds"))
                .createdAt(GraphRows.instant(row, "createdAt"))
                .readAt(GraphRows.instant(row, "readAt"))
                .actionedAt(GraphRows.instant(row, "actionedAt"))
                .dismissedAt(GraphRows.instant(row, "dismissedAt"))
                .build();
    }
}
