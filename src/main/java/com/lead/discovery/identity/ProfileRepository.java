package com.lead.discovery.identity;

import com.lead.discovery.core.model.Profile;

import java.util.Optional;

/**
 * System of record for profiles, unique on profileHash.
 */
public interface ProfileRepository {

    /**
     * Stores the profile unless one with the same profileHash exists.
     *
     * @return the stored profile, which is the pre-existing one when the hash was taken
     */
    Profile createIfAbsent(Profile profile);

    Optional<Profile> findById(String id);

    Optional<Profile> findByHash(String profileHash);

    /**
     * Overwrites an existing profile or restores a deleted one.
     */
    Profile save(Profile profile);

    boolean delete(String id);

    long count();
}
