package com.lead.discovery.matching;

import com.lead.discovery.core.model.Match;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link MatchRepository}. Upserts are atomic per (lead, service) key.
 */
public class InMemoryMatchRepository implements MatchRepository {

    static final Comparator<Match> BEST_FIRST =
            Comparator.comparingDouble(Match::getMatchScore).reversed().thenComparing(Match::getServiceId);

    private final ConcurrentMap<String, Match> matches = new ConcurrentHashMap<>();

    @Override
    public Match upsert(Match computed) {
        Match stored = matches.compute(key(computed.getLeadId(), computed.getServiceId()), (k, existing) -> {
            if (existing == null) {
                return copy(computed);
            }
            Match updated = copy(existing);
            updated.refreshScores(computed);
            return updated;
        });
        return copy(stored);
    }

    @Override
    public Match save(Match match) {
        matches.put(key(match.getLeadId(), match.getServiceId()), copy(match));
        return match;
    }

    @Override
    public Optional<Match> findById(String id) {
        return matches.values().stream()
                .filter(m -> m.getId().equals(id))
                .findFirst()
                .map(InMemoryMatchRepository::copy);
    }

    @Override
    public Optional<Match> findByLeadAndService(String leadId, String serviceId) {
        return Optional.ofNullable(matches.get(key(leadId, serviceId))).map(InMemoryMatchRepository::copy);
    }

    @Override
    public List<Match> findByLead(String leadId) {
        return matches.values().stream()
                .filter(m -> m.getLeadId().equals(leadId))
                .sorted(BEST_FIRST)
                .map(InMemoryMatchRepository::copy)
                .toList();
    }

    @Override
    public List<Match> findByService(String serviceId) {
        return matches.values().stream()
                .filter(m -> m.getServiceId().equals(serviceId))
                .sorted(BEST_FIRST)
                .map(InMemoryMatchRepository::copy)
                .toList();
    }

    @Override
    public List<Match> findAll() {
        return matches.values().stream()
                .sorted(BEST_FIRST)
                .map(InMemoryMatchRepository::copy)
                .toList();
    }

    @Override
    public int deleteByLead(String leadId) {
        int before = matches.size();
        matches.values().removeIf(m -> m.getLeadId().equals(leadId));
        return before - matches.size();
    }

    @Override
    public long count() {
        return matches.size();
    }

    private static String key(String leadId, String serviceId) {
        return leadId + "|" + serviceId;
    }

    private static Match copy(Match match) {
        return Match.builder(match).build();
    }
}
