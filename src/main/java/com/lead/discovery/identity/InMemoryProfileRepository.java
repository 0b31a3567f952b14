package com.lead.discovery.identity;

import com.lead.discovery.core.model.Profile;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory {@link ProfileRepository}. The hash index is claimed inside
 * {@code compute} so two concurrent builds of the same set share one profile.
 */
public class InMemoryProfileRepository implements ProfileRepository {

    private final ConcurrentMap<String, Profile> profiles = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idsByHash = new ConcurrentHashMap<>();

    @Override
    public Profile createIfAbsent(Profile profile) {
        AtomicReference<Profile> stored = new AtomicReference<>();
        idsByHash.compute(profile.getProfileHash(), (hash, existingId) -> {
            Profile existing = existingId != null ? profiles.get(existingId) : null;
            if (existing != null) {
                stored.set(copy(existing));
                return existingId;
            }
            // unclaimed, or claimed by a profile that has since been merged away
            profiles.put(profile.getId(), copy(profile));
            stored.set(copy(profile));
            return profile.getId();
        });
        return stored.get();
    }

    @Override
    public Optional<Profile> findById(String id) {
        return Optional.ofNullable(profiles.get(id)).map(InMemoryProfileRepository::copy);
    }

    @Override
    public Optional<Profile> findByHash(String profileHash) {
        String id = idsByHash.get(profileHash);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public Profile save(Profile profile) {
        profiles.put(profile.getId(), copy(profile));
        idsByHash.put(profile.getProfileHash(), profile.getId());
        return profile;
    }

    @Override
    public boolean delete(String id) {
        Profile removed = profiles.remove(id);
        if (removed == null) {
            return false;
        }
        idsByHash.remove(removed.getProfileHash(), id);
        return true;
    }

    @Override
    public long count() {
        return profiles.size();
    }

    private static Profile copy(Profile profile) {
        return Profile.builder(profile).build();
    }
}
