package com.lead.discovery.identity;

import com.lead.discovery.core.model.Identifier;
import com.lead.discovery.core.model.IdentifierType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory {@link IdentifierRepository}. Observations are applied with
 * {@link ConcurrentMap#compute} so concurrent sightings of one key never create two records.
 * Identifiers are copied on the way in and out, as a real store would.
 */
public class InMemoryIdentifierRepository implements IdentifierRepository {

    private final ConcurrentMap<Key, Identifier> byKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Key> keysById = new ConcurrentHashMap<>();

    @Override
    public ObservationResult recordObservation(IdentifierType type, String hash, String rawValue, String site,
                                               Map<String, String> metadata, Instant at, boolean allowAdditionalSites) {
        Key key = new Key(type, hash);
        AtomicBoolean created = new AtomicBoolean(false);
        Identifier stored = byKey.compute(key, (k, existing) -> {
            if (existing == null) {
                created.set(true);
                return Identifier.builder()
                        .type(type)
                        .hash(hash)
                        .rawValue(rawValue)
                        .sitesSeenOn(site != null && !site.isBlank() ? Set.of(site) : Set.of())
                        .firstSeen(at)
                        .lastSeen(at)
                        .metadata(metadata)
                        .build();
            }
            Identifier updated = copy(existing);
            boolean siteAllowed = allowAdditionalSites || updated.getSitesSeenOn().isEmpty();
            updated.recordSighting(siteAllowed ? site : null, at);
            updated.mergeMetadata(metadata);
            return updated;
        });
        keysById.put(stored.getId(), key);
        return new ObservationResult(copy(stored), created.get());
    }

    @Override
    public Optional<Identifier> findById(String id) {
        Key key = keysById.get(id);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key)).map(InMemoryIdentifierRepository::copy);
    }

    @Override
    public Optional<Identifier> findByTypeAndHash(IdentifierType type, String hash) {
        return Optional.ofNullable(byKey.get(new Key(type, hash))).map(InMemoryIdentifierRepository::copy);
    }

    @Override
    public List<Identifier> findByIds(Collection<String> ids) {
        List<Identifier> result = new ArrayList<>();
        for (String id : ids) {
            findById(id).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public List<Identifier> findByProfileId(String profileId) {
        return byKey.values().stream()
                .filter(i -> profileId.equals(i.getProfileId()))
                .sorted(Comparator.comparing(Identifier::getLastSeen).reversed())
                .map(InMemoryIdentifierRepository::copy)
                .toList();
    }

    @Override
    public Optional<Identifier> anonymize(String id) {
        return update(id, Identifier::anonymize);
    }

    @Override
    public Optional<Identifier> addSite(String id, String site) {
        return update(id, identifier -> identifier.addSite(site));
    }

    @Override
    public void assignProfile(Collection<String> identifierIds, String profileId) {
        for (String id : identifierIds) {
            update(id, identifier -> identifier.linkTo(profileId));
        }
    }

    @Override
    public List<String> reassignProfile(String fromProfileId, String toProfileId) {
        List<String> moved = new ArrayList<>();
        for (Key key : byKey.keySet()) {
            byKey.computeIfPresent(key, (k, existing) -> {
                if (!fromProfileId.equals(existing.getProfileId())) {
                    return existing;
                }
                Identifier updated = copy(existing);
                updated.linkTo(toProfileId);
                moved.add(updated.getId());
                return updated;
            });
        }
        return moved;
    }

    @Override
    public boolean delete(String id) {
        Key key = keysById.remove(id);
        return key != null && byKey.remove(key) != null;
    }

    @Override
    public long deleteUnlinkedLastSeenBefore(Instant cutoff) {
        List<Identifier> expired = byKey.values().stream()
                .filter(i -> !i.isLinked() && i.getLastSeen().isBefore(cutoff))
                .toList();
        long removed = 0;
        for (Identifier identifier : expired) {
            if (delete(identifier.getId())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<DuplicateProfilePair> findProfilesSharingHashes(int minShared) {
        Map<String, Set<String>> profilesByHash = new HashMap<>();
        for (Identifier identifier : byKey.values()) {
            if (identifier.isLinked()) {
                profilesByHash.computeIfAbsent(identifier.getHash(), h -> new HashSet<>())
                        .add(identifier.getProfileId());
            }
        }
        Map<List<String>, Integer> sharedCounts = new HashMap<>();
        for (Set<String> profiles : profilesByHash.values()) {
            List<String> sorted = profiles.stream().sorted().toList();
            for (int i = 0; i < sorted.size(); i++) {
                for (int j = i + 1; j < sorted.size(); j++) {
                    sharedCounts.merge(List.of(sorted.get(i), sorted.get(j)), 1, Integer::sum);
                }
            }
        }
        return sharedCounts.entrySet().stream()
                .filter(e -> e.getValue() >= minShared)
                .map(e -> new DuplicateProfilePair(e.getKey().get(0), e.getKey().get(1), e.getValue()))
                .sorted(Comparator.comparingInt(DuplicateProfilePair::sharedIdentifiers).reversed()
                        .thenComparing(DuplicateProfilePair::firstProfileId))
                .toList();
    }

    @Override
    public IdentifierStats stats() {
        Collection<Identifier> all = byKey.values();
        if (all.isEmpty()) {
            return IdentifierStats.empty();
        }
        Map<IdentifierType, Long> byType = new EnumMap<>(IdentifierType.class);
        byType.putAll(all.stream().collect(Collectors.groupingBy(Identifier::getType, Collectors.counting())));
        long linkedProfiles = all.stream()
                .map(Identifier::getProfileId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        long unlinked = all.stream().filter(i -> !i.isLinked()).count();
        double averageSeen = all.stream().mapToLong(Identifier::getSeenCount).average().orElse(0.0);
        return new IdentifierStats(all.size(), byType.size(), linkedProfiles, unlinked, averageSeen, byType);
    }

    private Optional<Identifier> update(String id, Consumer<Identifier> change) {
        Key key = keysById.get(id);
        if (key == null) {
            return Optional.empty();
        }
        Identifier updated = byKey.computeIfPresent(key, (k, existing) -> {
            Identifier copy = copy(existing);
            change.accept(copy);
            return copy;
        });
        return Optional.ofNullable(updated).map(InMemoryIdentifierRepository::copy);
    }

    private static Identifier copy(Identifier identifier) {
        return Identifier.builder(identifier).build();
    }

    private record Key(IdentifierType type, String hash) {
    }
}
