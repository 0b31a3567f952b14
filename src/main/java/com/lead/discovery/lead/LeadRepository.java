package com.lead.discovery.lead;

import com.lead.discovery.core.model.Lead;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * System of record for leads.
 */
public interface LeadRepository {

    Lead save(Lead lead);

    Optional<Lead> findById(String id);

    List<Lead> findAll();

    /**
     * Leads whose status is not terminal, newest first.
     */
    List<Lead> findActive();

    List<Lead> findByProfileId(String profileId);

    /**
     * Re-points every lead of {@code fromProfileId} at {@code toProfileId}.
     *
     * @return ids of the leads that were changed
     */
    List<String> reassignProfile(String fromProfileId, String toProfileId);

    void assignProfile(Collection<String> leadIds, String profileId);

    boolean delete(String id);

    long count();
}
