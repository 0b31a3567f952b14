package com.lead.discovery.matching;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lead.discovery.core.model.ConfidenceLevel;
import com.lead.discovery.core.model.Match;
import com.lead.discovery.core.model.MatchHistoryEntry;
import com.lead.discovery.core.model.MatchStatus;
import com.lead.discovery.core.model.Priority;
import com.lead.discovery.graph.GraphConnection;
import com.lead.discovery.graph.GraphRows;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed {@link MatchRepository}. The upsert is a single {@code MERGE} on
 * (leadId, serviceId) whose {@code ON CREATE} branch alone sets status, notes and history.
 */
public class GraphMatchRepository implements MatchRepository {

    private static final TypeReference<List<Map<String, String>>> HISTORY_TYPE = new TypeReference<>() {
    };

    private static final String RETURN_COLUMNS = """
            RETURN m.id as id, m.leadId as leadId, m.serviceId as serviceId, m.matchScore as matchScore,
                   m.geographicScore as geographicScore, m.industryScore as industryScore,
                   m.needScore as needScore, m.profileScore as profileScore,
                   m.behavioralScore as behavioralScore, m.confidenceLevel as confidenceLevel,
                   m.priority as priority, m.reasons as reasons, m.status as status, m.notes as notes,
                   m.history as history, m.createdAt as createdAt, m.updatedAt as updatedAt
            """;

    private final GraphConnection connection;

    public GraphMatchRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Match upsert(Match computed) {
        Map<String, Object> params = scoreParams(computed);
        params.put("id", computed.getId());
        params.put("status", computed.getStatus().name());
        params.put("notes", GraphRows.orEmpty(computed.getNotes()));
        params.put("history", historyJson(computed.getHistory()));
        params.put("createdAt", GraphRows.timestamp(computed.getCreatedAt()));
        List<Map<String, Object>> rows = connection.query("""
                MERGE (m:Match {leadId: $leadId, serviceId: $serviceId})
                ON CREATE SET m.id = $id, m.status = $status, m.notes = $notes, m.history = $history,
                              m.createdAt = $createdAt
                SET m.matchScore = $matchScore, m.geographicScore = $geographicScore,
                    m.industryScore = $industryScore, m.needScore = $needScore,
                    m.profileScore = $profileScore, m.behavioralScore = $behavioralScore,
                    m.confidenceLevel = $confidenceLevel, m.priority = $priority, m.reasons = $reasons,
                    m.updatedAt = $updatedAt
                """ + RETURN_COLUMNS, params);
        return rows.isEmpty() ? computed : toMatch(rows.get(0));
    }

    @Override
    public Match save(Match match) {
        Map<String, Object> params = scoreParams(match);
        params.put("id", match.getId());
        params.put("status", match.getStatus().name());
        params.put("notes", GraphRows.orEmpty(match.getNotes()));
        params.put("history", historyJson(match.getHistory()));
        params.put("createdAt", GraphRows.timestamp(match.getCreatedAt()));
        connection.execute("""
                MERGE (m:Match {leadId: $leadId, serviceId: $serviceId})
                SET m.id = $id, m.status = $status, m.notes = $notes, m.history = $history,
                    m.createdAt = $createdAt,
                    m.matchScore = $matchScore, m.geographicScore = $geographicScore,
                    m.industryScore = $industryScore, m.needScore = $needScore,
                    m.profileScore = $profileScore, m.behavioralScore = $behavioralScore,
                    m.confidenceLevel = $confidenceLevel, m.priority = $priority, m.reasons = $reasons,
                    m.updatedAt = $updatedAt
                """, params);
        return match;
    }

    @Override
    public Optional<Match> findById(String id) {
        return first(connection.query("MATCH (m:Match {id: $id})\n" + RETURN_COLUMNS, Map.of("id", id)));
    }

    @Override
    public Optional<Match> findByLeadAndService(String leadId, String serviceId) {
        return first(connection.query("MATCH (m:Match {leadId: $leadId, serviceId: $serviceId})\n" + RETURN_COLUMNS,
                Map.of("leadId", leadId, "serviceId", serviceId)));
    }

    @Override
    public List<Match> findByLead(String leadId) {
        return toMatches(connection.query("MATCH (m:Match {leadId: $leadId})\n" + RETURN_COLUMNS
                + "ORDER BY matchScore DESC", Map.of("leadId", leadId)));
    }

    @Override
    public List<Match> findByService(String serviceId) {
        return toMatches(connection.query("MATCH (m:Match {serviceId: $serviceId})\n" + RETURN_COLUMNS
                + "ORDER BY matchScore DESC", Map.of("serviceId", serviceId)));
    }

    @Override
    public List<Match> findAll() {
        return toMatches(connection.query("MATCH (m:Match)\n" + RETURN_COLUMNS + "ORDER BY matchScore DESC"));
    }

    @Override
    public int deleteByLead(String leadId) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (m:Match {leadId: $leadId})
                DELETE m
                RETURN count(m) as deleted
                """, Map.of("leadId", leadId));
        return rows.isEmpty() ? 0 : (int) GraphRows.longValue(rows.get(0), "deleted");
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = connection.query("MATCH (m:Match) RETURN count(m) as cnt");
        return rows.isEmpty() ? 0 : GraphRows.longValue(rows.get(0), "cnt");
    }

    private static Map<String, Object> scoreParams(Match match) {
        Map<String, Object> params = new HashMap<>();
        params.put("leadId", match.getLeadId());
        params.put("serviceId", match.getServiceId());
        params.put("matchScore", match.getMatchScore());
        params.put("geographicScore", match.getGeographicScore());
        params.put("industryScore", match.getIndustryScore());
        params.put("needScore", match.getNeedScore());
        params.put("profileScore", match.getProfileScore());
        params.put("behavioralScore", match.getBehavioralScore());
        params.put("confidenceLevel", match.getConfidenceLevel().name());
        params.put("priority", match.getPriority().name());
        params.put("reasons", match.getReasons());
        params.put("updatedAt", GraphRows.timestamp(match.getUpdatedAt()));
        return params;
    }

    private static String historyJson(List<MatchHistoryEntry> history) {
        List<Map<String, String>> entries = history.stream().map(h -> {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("status", h.status().name());
            entry.put("notes", GraphRows.orEmpty(h.notes()));
            entry.put("at", GraphRows.timestamp(h.at()));
            return entry;
        }).toList();
        return GraphRows.toJson(entries);
    }

    private static List<MatchHistoryEntry> history(String json) {
        return GraphRows.fromJson(json, HISTORY_TYPE, List.of()).stream()
                .map(e -> new MatchHistoryEntry(MatchStatus.valueOf(e.get("status")),
                        e.get("notes") == null || e.get("notes").isEmpty() ? null : e.get("notes"),
                        Instant.parse(e.get("at"))))
                .toList();
    }

    private Optional<Match> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(toMatch(rows.get(0)));
    }

    private List<Match> toMatches(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toMatch).toList();
    }

    private Match toMatch(Map<String, Object> row) {
        return Match.builder()
                .id(GraphRows.string(row, "id"))
                .leadId(GraphRows.string(row, "leadId"))
                .serviceId(GraphRows.string(row, "serviceId"))
                .matchScore(GraphRows.doubleValue(row, "matchScore"))
                .geographicScore(GraphRows.doubleValue(row, "geographicScore"))
                .industryScore(GraphRows.doubleValue(row, "industryScore"))
                .needScore(GraphRows.doubleValue(row, "needScore"))
                .profileScore(GraphRows.doubleValue(row, "profileScore"))
                .behavioralScore(GraphRows.doubleValue(row, "behavioralScore"))
                .confidenceLevel(ConfidenceLevel.valueOf(GraphRows.string(row, "confidenceLevel")))
                .priority(Priority.valueOf(GraphRows.string(row, "priority")))
                .reasons(GraphRows.stringList(row, "reasons"))
                .status(MatchStatus.valueOf(GraphRows.string(row, "status")))
                .notes(GraphRows.string(row, "notes"))
                .history(history(GraphRows.string(row, "history")))
                .createdAt(GraphRows.instant(row, "createdAt"))
                .updatedAt(GraphRows.instant(row, "updatedAt"))
                .build();
    }
}
