package com.lead.discovery.lead;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.LeadStatus;
import com.lead.discovery.core.model.LeadType;
import com.lead.discovery.core.model.Signal;
import com.lead.discovery.graph.GraphConnection;
import com.lead.discovery.graph.GraphRows;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed {@link LeadRepository}. Signals are stored as a JSON string property.
 */
public class GraphLeadRepository implements LeadRepository {

    private static final TypeReference<List<Signal>> SIGNALS_TYPE = new TypeReference<>() {
    };

    private static final String RETURN_COLUMNS = """
            RETURN l.id as id, l.type as type, l.name as name, l.email as email, l.phone as phone,
                   l.company as company, l.website as website, l.address as address, l.city as city,
                   l.state as state, l.country as country, l.postalCode as postalCode,
                   l.latitude as latitude, l.longitude as longitude, l.industry as industry,
                   l.companySize as companySize, l.revenueRange as revenueRange,
                   l.employeeCount as employeeCount, l.leadCategory as leadCategory, l.source as source,
                   l.signals as signals, l.signalStrength as signalStrength, l.intentScore as intentScore,
                   l.needs as needs, l.status as status, l.profileId as profileId,
                   l.createdAt as createdAt, l.updatedAt as updatedAt
            """;

    private final GraphConnection connection;

    public GraphLeadRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Lead save(Lead lead) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", lead.getId());
        params.put("type", lead.getType().name());
        params.put("name", GraphRows.orEmpty(lead.getName()));
        params.put("email", GraphRows.orEmpty(lead.getEmail()));
        params.put("phone", GraphRows.orEmpty(lead.getPhone()));
        params.put("company", GraphRows.orEmpty(lead.getCompany()));
        params.put("website", GraphRows.orEmpty(lead.getWebsite()));
        params.put("address", GraphRows.orEmpty(lead.getAddress()));
        params.put("city", GraphRows.orEmpty(lead.getCity()));
        params.put("state", GraphRows.orEmpty(lead.getState()));
        params.put("country", GraphRows.orEmpty(lead.getCountry()));
        params.put("postalCode", GraphRows.orEmpty(lead.getPostalCode()));
        params.put("latitude", lead.getLatitude());
        params.put("longitude", lead.getLongitude());
        params.put("industry", GraphRows.orEmpty(lead.getIndustry()));
        params.put("companySize", GraphRows.orEmpty(lead.getCompanySize()));
        params.put("revenueRange", GraphRows.orEmpty(lead.getRevenueRange()));
        params.put("employeeCount", lead.getEmployeeCount());
        params.put("leadCategory", GraphRows.orEmpty(lead.getLeadCategory()));
        params.put("source", GraphRows.orEmpty(lead.getSource()));
        params.put("signals", GraphRows.toJson(lead.getSignals()));
        params.put("signalStrength", lead.getSignalStrength());
        params.put("intentScore", lead.getIntentScore());
        params.put("needs", List.copyOf(lead.getNeedsIdentified()));
        params.put("status", lead.getStatus().name());
        params.put("profileId", GraphRows.orEmpty(lead.getProfileId()));
        params.put("createdAt", GraphRows.timestamp(lead.getCreatedAt()));
        params.put("updatedAt", GraphRows.timestamp(lead.getUpdatedAt()));
        connection.execute("""
                MERGE (l:Lead {id: $id})
                SET l.type = $type, l.name = $name, l.email = $email, l.phone = $phone,
                    l.company = $company, l.website = $website, l.address = $address, l.city = $city,
                    l.state = $state, l.country = $country, l.postalCode = $postalCode,
                    l.latitude = $latitude, l.longitude = $longitude, l.industry = $industry,
                    l.companySize = $companySize, l.revenueRange = $revenueRange,
                    l.employeeCount = $employeeCount, l.leadCategory = $leadCategory, l.source = $source,
                    l.signals = $signals, l.signalStrength = $signalStrength, l.intentScore = $intentScore,
                    l.needs = $needs, l.status = $status, l.profileId = $profileId,
                    l.createdAt = $createdAt, l.updatedAt = $updatedAt
                """, params);
        return lead;
    }

    @Override
    public Optional<Lead> findById(String id) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (l:Lead {id: $id})\n" + RETURN_COLUMNS, Map.of("id", id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(toLead(rows.get(0)));
    }

    @Override
    public List<Lead> findAll() {
        return toLeads(connection.query("MATCH (l:Lead)\n" + RETURN_COLUMNS + "ORDER BY createdAt DESC"));
    }

    @Override
    public List<Lead> findActive() {
        return toLeads(connection.query("""
                MATCH (l:Lead)
                WHERE l.status <> 'LOST' AND l.status <> 'INVALID'
                """ + RETURN_COLUMNS + "ORDER BY createdAt DESC"));
    }

    @Override
    public List<Lead> findByProfileId(String profileId) {
        return toLeads(connection.query("MATCH (l:Lead {profileId: $profileId})\n" + RETURN_COLUMNS
                + "ORDER BY createdAt DESC", Map.of("profileId", profileId)));
    }

    @Override
    public List<String> reassignProfile(String fromProfileId, String toProfileId) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (l:Lead {profileId: $fromProfileId})
                SET l.profileId = $toProfileId
                RETURN l.id as id
                """, Map.of("fromProfileId", fromProfileId, "toProfileId", toProfileId));
        return rows.stream().map(r -> GraphRows.string(r, "id")).toList();
    }

    @Override
    public void assignProfile(Collection<String> leadIds, String profileId) {
        if (leadIds.isEmpty()) {
            return;
        }
        connection.execute("""
                MATCH (l:Lead)
                WHERE l.id IN $ids
                SET l.profileId = $profileId
                """, Map.of("ids", List.copyOf(leadIds), "profileId", GraphRows.orEmpty(profileId)));
    }

    @Override
    public boolean delete(String id) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (l:Lead {id: $id})
                DELETE l
                RETURN count(l) as deleted
                """, Map.of("id", id));
        return !rows.isEmpty() && GraphRows.longValue(rows.get(0), "deleted") > 0;
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = connection.query("MATCH (l:Lead) RETURN count(l) as cnt");
        return rows.isEmpty() ? 0 : GraphRows.longValue(rows.get(0), "cnt");
    }

    private List<Lead> toLeads(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toLead).toList();
    }

    private Lead toLead(Map<String, Object> row) {
        long employees = GraphRows.longValue(row, "employeeCount");
        return Lead.builder()
                .id(GraphRows.string(row, "id"))
                .type(LeadType.valueOf(GraphRows.string(row, "type")))
                .name(GraphRows.string(row, "name"))
                .email(GraphRows.string(row, "email"))
                .phone(GraphRows.string(row, "phone"))
                .company(GraphRows.string(row, "company"))
                .website(GraphRows.string(row, "website"))
                .address(GraphRows.string(row, "address"))
                .city(GraphRows.string(row, "city"))
                .state(GraphRows.string(row, "state"))
                .country(GraphRows.string(row, "country"))
                .postalCode(GraphRows.string(row, "postalCode"))
                .latitude(GraphRows.nullableDouble(row, "latitude"))
                .longitude(GraphRows.nullableDouble(row, "longitude"))
                .industry(GraphRows.string(row, "industry"))
                .companySize(GraphRows.string(row, "companySize"))
                .revenueRange(GraphRows.string(row, "revenueRange"))
                .employeeCount(row.get("employeeCount") != null ? (int) employees : null)
                .leadCategory(GraphRows.string(row, "leadCategory"))
                .source(GraphRows.string(row, "source"))
                .signals(GraphRows.fromJson(GraphRows.string(row, "signals"), SIGNALS_TYPE, List.of()))
                .signalStrength((int) GraphRows.longValue(row, "signalStrength"))
                .intentScore((int) GraphRows.longValue(row, "intentScore"))
                .needsIdentified(GraphRows.stringSet(row, "needs"))
                .status(LeadStatus.valueOf(GraphRows.string(row, "status")))
                .profileId(GraphRows.string(row, "profileId"))
                .createdAt(GraphRows.instant(row, "createdAt"))
                .updatedAt(GraphRows.instant(row, "updatedAt"))
                .build();
    }
}
