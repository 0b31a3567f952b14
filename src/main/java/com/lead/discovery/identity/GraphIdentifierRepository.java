package com.lead.discovery.identity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lead.discovery.core.model.Identifier;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.graph.GraphConnection;
import com.lead.discovery.graph.GraphRows;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * FalkorDB-backed {@link IdentifierRepository}. Identifiers are {@code :Identifier} nodes;
 * {@code MERGE} on (type, hash) makes observations idempotent. An unlinked identifier
 * stores the empty string as its profileId.
 */
public class GraphIdentifierRepository implements IdentifierRepository {

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String RETURN_COLUMNS = """
            RETURN i.id as id, i.type as type, i.hash as hash, i.rawValue as rawValue,
                   i.sites as sites, i.seenCount as seenCount, i.firstSeen as firstSeen,
                   i.lastSeen as lastSeen, i.profileId as profileId, i.metadata as metadata,
                   i.anonymized as anonymized
            """;

    private final GraphConnection connection;

    public GraphIdentifierRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public ObservationResult recordObservation(IdentifierType type, String hash, String rawValue, String site,
                                               Map<String, String> metadata, Instant at, boolean allowAdditionalSites) {
        String newId = UUID.randomUUID().toString();
        String siteValue = site != null && !site.isBlank() ? site : "";
        Map<String, Object> params = new HashMap<>();
        params.put("type", type.name());
        params.put("hash", hash);
        params.put("newId", newId);
        params.put("rawValue", GraphRows.orEmpty(rawValue));
        params.put("initialSites", siteValue.isEmpty() ? List.of() : List.of(siteValue));
        params.put("site", siteValue);
        params.put("allowSites", allowAdditionalSites);
        params.put("at", GraphRows.timestamp(at));
        params.put("metadata", GraphRows.toJson(metadata != null ? metadata : Map.of()));

        List<Map<String, Object>> rows = connection.query("""
                MERGE (i:Identifier {type: $type, hash: $hash})
                ON CREATE SET i.id = $newId, i.rawValue = $rawValue, i.sites = $initialSites,
                              i.seenCount = 1, i.firstSeen = $at, i.lastSeen = $at,
                              i.profileId = '', i.metadata = $metadata
                ON MATCH SET i.seenCount = i.seenCount + 1, i.lastSeen = $at,
                             i.sites = CASE
                                 WHEN $site = '' OR $site IN i.sites THEN i.sites
                                 WHEN $allowSites = false AND size(i.sites) > 0 THEN i.sites
                                 ELSE i.sites + [$site] END
                """ + RETURN_COLUMNS, params);
        if (rows.isEmpty()) {
            throw new IllegalStateException("MERGE returned no row for identifier " + type + ":" + hash);
        }
        Identifier identifier = toIdentifier(rows.get(0));
        return new ObservationResult(identifier, newId.equals(identifier.getId()));
    }

    @Override
    public Optional<Identifier> findById(String id) {
        return first(connection.query("MATCH (i:Identifier {id: $id})\n" + RETURN_COLUMNS, Map.of("id", id)));
    }

    @Override
    public Optional<Identifier> findByTypeAndHash(IdentifierType type, String hash) {
        return first(connection.query("MATCH (i:Identifier {type: $type, hash: $hash})\n" + RETURN_COLUMNS,
                Map.of("type", type.name(), "hash", hash)));
    }

    @Override
    public List<Identifier> findByIds(Collection<String> ids) {
        return map(connection.query("MATCH (i:Identifier)\nWHERE i.id IN $ids\n" + RETURN_COLUMNS,
                Map.of("ids", List.copyOf(ids))));
    }

    @Override
    public List<Identifier> findByProfileId(String profileId) {
        return map(connection.query("MATCH (i:Identifier {profileId: $profileId})\n" + RETURN_COLUMNS
                + "ORDER BY i.lastSeen DESC", Map.of("profileId", profileId)));
    }

    @Override
    public Optional<Identifier> anonymize(String id) {
        return first(connection.query("""
                MATCH (i:Identifier {id: $id})
                SET i.rawValue = $rawValue, i.anonymized = true
                """ + RETURN_COLUMNS, Map.of("id", id, "rawValue", Identifier.ANONYMIZED_VALUE)));
    }

    @Override
    public Optional<Identifier> addSite(String id, String site) {
        return first(connection.query("""
                MATCH (i:Identifier {id: $id})
                SET i.sites = CASE WHEN $site IN i.sites THEN i.sites ELSE i.sites + [$site] END
                """ + RETURN_COLUMNS, Map.of("id", id, "site", site)));
    }

    @Override
    public void assignProfile(Collection<String> identifierIds, String profileId) {
        if (identifierIds.isEmpty()) {
            return;
        }
        connection.execute("""
                MATCH (i:Identifier)
                WHERE i.id IN $ids
                SET i.profileId = $profileId
                """, Map.of("ids", List.copyOf(identifierIds), "profileId", GraphRows.orEmpty(profileId)));
    }

    @Override
    public List<String> reassignProfile(String fromProfileId, String toProfileId) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (i:Identifier {profileId: $from})
                SET i.profileId = $to
                RETURN i.id as id
                """, Map.of("from", fromProfileId, "to", toProfileId));
        return rows.stream().map(row -> GraphRows.string(row, "id")).toList();
    }

    @Override
    public boolean delete(String id) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (i:Identifier {id: $id})
                DELETE i
                RETURN count(i) as deleted
                """, Map.of("id", id));
        return !rows.isEmpty() && GraphRows.longValue(rows.get(0), "deleted") > 0;
    }

    @Override
    public long deleteUnlinkedLastSeenBefore(Instant cutoff) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (i:Identifier)
                WHERE i.profileId = '' AND i.lastSeen < $cutoff
                DELETE i
                RETURN count(i) as deleted
                """, Map.of("cutoff", GraphRows.timestamp(cutoff)));
        return rows.isEmpty() ? 0 : GraphRows.longValue(rows.get(0), "deleted");
    }

    @Override
    public List<DuplicateProfilePair> findProfilesSharingHashes(int minShared) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (a:Identifier), (b:Identifier)
                WHERE a.hash = b.hash AND a.profileId <> '' AND b.profileId <> ''
                  AND a.profileId < b.profileId
                WITH a.profileId as first, b.profileId as second, count(*) as shared
                WHERE shared >= $minShared
                RETURN first, second, shared
                ORDER BY shared DESC, first ASC
                """, Map.of("minShared", minShared));
        return rows.stream()
                .map(row -> new DuplicateProfilePair(
                        GraphRows.string(row, "first"),
                        GraphRows.string(row, "second"),
                        (int) GraphRows.longValue(row, "shared")))
                .toList();
    }

    @Override
    public IdentifierStats stats() {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (i:Identifier)
                RETURN i.type as type, count(i) as cnt, sum(i.seenCount) as seen,
                       sum(CASE WHEN i.profileId = '' THEN 1 ELSE 0 END) as unlinked
                """);
        if (rows.isEmpty()) {
            return IdentifierStats.empty();
        }
        Map<IdentifierType, Long> byType = new EnumMap<>(IdentifierType.class);
        long total = 0;
        long seen = 0;
        long unlinked = 0;
        for (Map<String, Object> row : rows) {
            long count = GraphRows.longValue(row, "cnt");
            byType.put(IdentifierType.valueOf(GraphRows.string(row, "type")), count);
            total += count;
            seen += GraphRows.longValue(row, "seen");
            unlinked += GraphRows.longValue(row, "unlinked");
        }
        List<Map<String, Object>> profileRows = connection.query("""
                MATCH (i:Identifier)
                WHERE i.profileId <> ''
                RETURN count(DISTINCT i.profileId) as profiles
                """);
        long linkedProfiles = profileRows.isEmpty() ? 0 : GraphRows.longValue(profileRows.get(0), "profiles");
        double average = total == 0 ? 0.0 : (double) seen / total;
        return new IdentifierStats(total, byType.size(), linkedProfiles, unlinked, average, byType);
    }

    private Optional<Identifier> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(toIdentifier(rows.get(0)));
    }

    private List<Identifier> map(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toIdentifier).toList();
    }

    private Identifier toIdentifier(Map<String, Object> row) {
        Map<String, String> metadata = new HashMap<>(
                GraphRows.fromJson(GraphRows.string(row, "metadata"), METADATA_TYPE, Map.of()));
        if (GraphRows.bool(row, "anonymized")) {
            metadata.put("anonymized", "true");
        }
        return Identifier.builder()
                .id(GraphRows.string(row, "id"))
                .type(IdentifierType.valueOf(GraphRows.string(row, "type")))
                .hash(GraphRows.string(row, "hash"))
                .rawValue(GraphRows.string(row, "rawValue"))
                .sitesSeenOn(GraphRows.stringSet(row, "sites"))
                .seenCount(Math.max(1, GraphRows.longValue(row, "seenCount")))
                .firstSeen(GraphRows.instant(row, "firstSeen"))
                .lastSeen(GraphRows.instant(row, "lastSeen"))
                .profileId(GraphRows.string(row, "profileId"))
                .metadata(metadata)
                .build();
    }
}
