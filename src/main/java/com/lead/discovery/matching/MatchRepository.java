package com.lead.discovery.matching;

import com.lead.discovery.core.model.Match;

import java.util.List;
import java.util.Optional;

/**
 * System of record for matches, keyed by (leadId, serviceId).
 */
public interface MatchRepository {

    /**
     * Inserts the match or, when one exists for the same lead and service, overwrites its
     * scores, confidence, priority and reasons while keeping its id, status, notes and history.
     *
     * @return the stored match
     */
    Match upsert(Match computed);

    /**
     * Replaces the stored match with the same id (status and notes updates).
     */
    Match save(Match match);

    Optional<Match> findById(String id);

    Optional<Match> findByLeadAndService(String leadId, String serviceId);

    /**
     * Matches of a lead, best score first.
     */
    List<Match> findByLead(String leadId);

    List<Match> findByService(String serviceId);

    List<Match> findAll();

    /**
     * Removes every match of a lead. Returns the number removed.
     */
    int deleteByLead(String leadId);

    long count();
}
