package com.lead.discovery.identity;

import com.lead.discovery.core.model.Identifier;
import com.lead.discovery.core.model.IdentifierType;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * System of record for identifiers, keyed on (type, hash).
 */
public interface IdentifierRepository {

    /**
     * Atomically creates the identifier or applies a repeat sighting to it.
     *
     * @param site                  site of the observation, may be null
     * @param allowAdditionalSites  when false, a site is only recorded on an identifier that
     *                              has no site yet, so no cross-site trail builds up
     */
    ObservationResult recordObservation(IdentifierType type, String hash, String rawValue, String site,
                                        Map<String, String> metadata, Instant at, boolean allowAdditionalSites);

    Optional<Identifier> findById(String id);

    Optional<Identifier> findByTypeAndHash(IdentifierType type, String hash);

    List<Identifier> findByIds(Collection<String> ids);

    List<Identifier> findByProfileId(String profileId);

    /**
     * Replaces the raw value with {@link Identifier#ANONYMIZED_VALUE} and flags the metadata.
     * Only those fields are written, so ownership and counters stay as stored.
     *
     * @return the updated identifier, empty if it does not exist
     */
    Optional<Identifier> anonymize(String id);

    /**
     * Adds {@code site} to the identifier's sites without touching any other field.
     *
     * @return the updated identifier, empty if it does not exist
     */
    Optional<Identifier> addSite(String id, String site);

    /**
     * Points every given identifier at {@code profileId} (null unlinks).
     */
    void assignProfile(Collection<String> identifierIds, String profileId);

    /**
     * Moves every identifier currently owned by {@code fromProfileId} to {@code toProfileId}.
     *
     * @return ids of the identifiers moved
     */
    List<String> reassignProfile(String fromProfileId, String toProfileId);

    boolean delete(String id);

    long deleteUnlinkedLastSeenBefore(Instant cutoff);

    /**
     * Pairs of distinct profiles whose identifiers carry at least {@code minShared} equal
     * digest values, most shared first. Because a (type, hash) pair is owned by one profile,
     * the comparison is on the digest alone.
     */
    List<DuplicateProfilePair> findProfilesSharingHashes(int minShared);

    IdentifierStats stats();
}
