package com.lead.discovery.identity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lead.discovery.core.model.Profile;
import com.lead.discovery.graph.GraphConnection;
import com.lead.discovery.graph.GraphRows;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed {@link ProfileRepository}. {@code MERGE} on profileHash gives the
 * same idempotence as the unique index would in a relational store.
 */
public class GraphProfileRepository implements ProfileRepository {

    private static final TypeReference<Map<String, Integer>> COUNTS_TYPE = new TypeReference<>() {
    };

    private static final String RETURN_COLUMNS = """
            RETURN p.id as id, p.profileHash as profileHash, p.email as email, p.phone as phone,
                   p.name as name, p.company as company, p.sites as sites, p.ips as ips,
                   p.fingerprint as fingerprint, p.behaviors as behaviors,
                   p.createdAt as createdAt, p.updatedAt as updatedAt
            """;

    private final GraphConnection connection;

    public GraphProfileRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Profile createIfAbsent(Profile profile) {
        Map<String, Object> params = params(profile);
        List<Map<String, Object>> rows = connection.query("""
                MERGE (p:Profile {profileHash: $profileHash})
                ON CREATE SET p.id = $id, p.email = $email, p.phone = $phone, p.name = $name,
                              p.company = $company, p.sites = $sites, p.ips = $ips,
                              p.fingerprint = $fingerprint, p.behaviors = $behaviors,
                              p.createdAt = $createdAt, p.updatedAt = $updatedAt
                """ + RETURN_COLUMNS, params);
        return rows.isEmpty() ? profile : toProfile(rows.get(0));
    }

    @Override
    public Optional<Profile> findById(String id) {
        return first(connection.query("MATCH (p:Profile {id: $id})\n" + RETURN_COLUMNS, Map.of("id", id)));
    }

    @Override
    public Optional<Profile> findByHash(String profileHash) {
        return first(connection.query("MATCH (p:Profile {profileHash: $profileHash})\n" + RETURN_COLUMNS,
                Map.of("profileHash", profileHash)));
    }

    @Override
    public Profile save(Profile profile) {
        connection.execute("""
                MERGE (p:Profile {id: $id})
                SET p.profileHash = $profileHash, p.email = $email, p.phone = $phone, p.name = $name,
                    p.company = $company, p.sites = $sites, p.ips = $ips, p.fingerprint = $fingerprint,
                    p.behaviors = $behaviors, p.createdAt = $createdAt, p.updatedAt = $updatedAt
                """, params(profile));
        return profile;
    }

    @Override
    public boolean delete(String id) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (p:Profile {id: $id})
                DELETE p
                RETURN count(p) as deleted
                """, Map.of("id", id));
        return !rows.isEmpty() && GraphRows.longValue(rows.get(0), "deleted") > 0;
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = connection.query("MATCH (p:Profile) RETURN count(p) as cnt");
        return rows.isEmpty() ? 0 : GraphRows.longValue(rows.get(0), "cnt");
    }

    private Map<String, Object> params(Profile profile) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", profile.getId());
        params.put("profileHash", profile.getProfileHash());
        params.put("email", GraphRows.orEmpty(profile.getEmail()));
        params.put("phone", GraphRows.orEmpty(profile.getPhone()));
        params.put("name", GraphRows.orEmpty(profile.getName()));
        params.put("company", GraphRows.orEmpty(profile.getCompany()));
        params.put("sites", List.copyOf(profile.getSitesVisited()));
        params.put("ips", List.copyOf(profile.getIpAddresses()));
        params.put("fingerprint", GraphRows.orEmpty(profile.getDeviceFingerprint()));
        params.put("behaviors", GraphRows.toJson(profile.getBehaviorCounts()));
        params.put("createdAt", GraphRows.timestamp(profile.getCreatedAt()));
        params.put("updatedAt", GraphRows.timestamp(profile.getUpdatedAt()));
        return params;
    }

    private Optional<Profile> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(toProfile(rows.get(0)));
    }

    private Profile toProfile(Map<String, Object> row) {
        return Profile.builder()
                .id(GraphRows.string(row, "id"))
                .profileHash(GraphRows.string(row, "profileHash"))
                .email(GraphRows.string(row, "email"))
                .phone(GraphRows.string(row, "phone"))
                .name(GraphRows.string(row, "name"))
                .company(GraphRows.string(row, "company"))
                .sitesVisited(GraphRows.stringSet(row, "sites"))
                .ipAddresses(GraphRows.stringSet(row, "ips"))
                .deviceFingerprint(GraphRows.string(row, "fingerprint"))
                .behaviorCounts(GraphRows.fromJson(GraphRows.string(row, "behaviors"), COUNTS_TYPE, Map.of()))
                .createdAt(GraphRows.instant(row, "createdAt"))
                .updatedAt(GraphRows.instant(row, "updatedAt"))
                .build();
    }
}
