package com.lead.discovery.lead;

import com.lead.discovery.core.model.Lead;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link LeadRepository}; leads are copied in and out.
 */
public class InMemoryLeadRepository implements LeadRepository {

    private static final Comparator<Lead> NEWEST_FIRST =
            Comparator.comparing(Lead::getCreatedAt).reversed().thenComparing(Lead::getId);

    private final ConcurrentMap<String, Lead> leads = new ConcurrentHashMap<>();

    @Override
    public Lead save(Lead lead) {
        leads.put(lead.getId(), copy(lead));
        return lead;
    }

    @Override
    public Optional<Lead> findById(String id) {
        return Optional.ofNullable(leads.get(id)).map(InMemoryLeadRepository::copy);
    }

    @Override
    public List<Lead> findAll() {
        return leads.values().stream()
                .sorted(NEWEST_FIRST)
                .map(InMemoryLeadRepository::copy)
                .toList();
    }

    @Override
    public List<Lead> findActive() {
        return leads.values().stream()
                .filter(Lead::isEligibleForMatching)
                .sorted(NEWEST_FIRST)
                .map(InMemoryLeadRepository::copy)
                .toList();
    }

    @Override
    public List<Lead> findByProfileId(String profileId) {
        return leads.values().stream()
                .filter(l -> Objects.equals(profileId, l.getProfileId()))
                .sorted(NEWEST_FIRST)
                .map(InMemoryLeadRepository::copy)
                .toList();
    }

    @Override
    public List<String> reassignProfile(String fromProfileId, String toProfileId) {
        List<String> changed = new ArrayList<>();
        for (Lead lead : leads.values()) {
            if (Objects.equals(fromProfileId, lead.getProfileId())) {
                changed.add(lead.getId());
            }
        }
        assignProfile(changed, toProfileId);
        return changed;
    }

    @Override
    public void assignProfile(Collection<String> leadIds, String profileId) {
        for (String id : leadIds) {
            leads.computeIfPresent(id, (k, existing) -> {
                Lead updated = copy(existing);
                updated.setProfileId(profileId);
                return updated;
            });
        }
    }

    @Override
    public boolean delete(String id) {
        return leads.remove(id) != null;
    }

    @Override
    public long count() {
        return leads.size();
    }

    private static Lead copy(Lead lead) {
        return Lead.builder(lead).build();
    }
}
