package com.lead.discovery.core.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One observed tracking value. The pair (type, hash) is its identity:
 * two observations with the same pair are the same identifier.
 */
public class Identifier {
    public static final String ANONYMIZED_VALUE = "ANONYMIZED";

    private final String id;
    private final IdentifierType type;
    private final String hash;
    private String rawValue;
    private final Set<String> sitesSeenOn;
    private long seenCount;
    private final Instant firstSeen;
    private Instant lastSeen;
    private String profileId;
    private final Map<String, String> metadata;

    private Identifier(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.hash = builder.hash;
        this.rawValue = builder.rawValue;
        this.sitesSeenOn = new LinkedHashSet<>(builder.sitesSeenOn);
        this.seenCount = builder.seenCount;
        this.firstSeen = builder.firstSeen != null ? builder.firstSeen : Instant.now();
        this.lastSeen = builder.lastSeen != null ? builder.lastSeen : this.firstSeen;
        this.profileId = builder.profileId;
        this.metadata = new HashMap<>(builder.metadata);
    }

    public String getId() {
        return id;
    }

    public IdentifierType getType() {
        return type;
    }

    public String getHash() {
        return hash;
    }

    public String getRawValue() {
        return rawValue;
    }

    public Set<String> getSitesSeenOn() {
        return Set.copyOf(sitesSeenOn);
    }

    public long getSeenCount() {
        return seenCount;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public String getProfileId() {
        return profileId;
    }

    public Map<String, String> getMetadata() {
        return Map.copyOf(metadata);
    }

    public boolean isLinked() {
        return profileId != null;
    }

    public boolean isAnonymized() {
        return "true".equals(metadata.get("anonymized"));
    }

    /**
     * Records a repeat observation: bumps the count, refreshes lastSeen and adds the site.
     */
    public void recordSighting(String site, Instant at) {
        seenCount++;
        lastSeen = at;
        if (site != null && !site.isBlank()) {
            sitesSeenOn.add(site);
        }
    }

    public void addSite(String site) {
        sitesSeenOn.add(site);
    }

    public void mergeMetadata(Map<String, String> extra) {
        if (extra != null) {
            metadata.putAll(extra);
        }
    }

    public void linkTo(String profileId) {
        this.profileId = profileId;
    }

    /**
     * Replaces the raw value with a sentinel. The hash is kept so correlation continues.
     */
    public void anonymize() {
        this.rawValue = ANONYMIZED_VALUE;
        this.metadata.put("anonymized", "true");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return type == that.type && Objects.equals(hash, that.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, hash);
    }

    @Override
    public String toString() {
        return "Identifier{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", hash='" + hash + '\'' +
                ", seenCount=" + seenCount +
                ", profileId='" + profileId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copies every field, used to snapshot state before a mutation that may need undoing.
     */
    public static Builder builder(Identifier identifier) {
        return new Builder()
                .id(identifier.id)
                .type(identifier.type)
                .hash(identifier.hash)
                .rawValue(identifier.rawValue)
                .sitesSeenOn(identifier.sitesSeenOn)
                .seenCount(identifier.seenCount)
                .firstSeen(identifier.firstSeen)
                .lastSeen(identifier.lastSeen)
                .profileId(identifier.profileId)
                .metadata(identifier.metadata);
    }

    public static class Builder {
        private String id;
        private IdentifierType type;
        private String hash;
        private String rawValue;
        private Set<String> sitesSeenOn = Set.of();
        private long seenCount = 1;
        private Instant firstSeen;
        private Instant lastSeen;
        private String profileId;
        private Map<String, String> metadata = Map.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(IdentifierType type) {
            this.type = type;
            return this;
        }

        public Builder hash(String hash) {
            this.hash = hash;
            return this;
        }

        public Builder rawValue(String rawValue) {
            this.rawValue = rawValue;
            return this;
        }

        public Builder sitesSeenOn(Set<String> sitesSeenOn) {
            this.sitesSeenOn = sitesSeenOn != null ? sitesSeenOn : Set.of();
            return this;
        }

        public Builder seenCount(long seenCount) {
            this.seenCount = seenCount;
            return this;
        }

        public Builder firstSeen(Instant firstSeen) {
            this.firstSeen = firstSeen;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata != null ? metadata : Map.of();
            return this;
        }

        public Identifier build() {
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(hash, "hash is required");
            return new Identifier(this);
        }
    }
}
