package com.lead.discovery.core.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A merged entity standing for one real-world visitor or organization,
 * built from correlated identifiers.
 */
public class Profile {
    private final String id;
    private final String profileHash;
    private String email;
    private String phone;
    private String name;
    private String company;
    private final Set<String> sitesVisited;
    private final Set<String> ipAddresses;
    private String deviceFingerprint;
    private final Map<String, Integer> behaviorCounts;
    private final Instant createdAt;
    private Instant updatedAt;

    private Profile(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.profileHash = builder.profileHash;
        this.email = builder.email;
        this.phone = builder.phone;
        this.name = builder.name;
        this.company = builder.company;
        this.sitesVisited = new LinkedHashSet<>(builder.sitesVisited);
        this.ipAddresses = new LinkedHashSet<>(builder.ipAddresses);
        this.deviceFingerprint = builder.deviceFingerprint;
        this.behaviorCounts = new HashMap<>(builder.behaviorCounts);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getProfileHash() {
        return profileHash;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
        this.updatedAt = Instant.now();
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
        this.updatedAt = Instant.now();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        this.updatedAt = Instant.now();
    }

    public String getCompany() {
        return company;
    }

    public void setCompany(String company) {
        this.company = company;
        this.updatedAt = Instant.now();
    }

    public Set<String> getSitesVisited() {
        return Set.copyOf(sitesVisited);
    }

    public void addSite(String site) {
        sitesVisited.add(site);
        this.updatedAt = Instant.now();
    }

    public Set<String> getIpAddresses() {
        return Set.copyOf(ipAddresses);
    }

    public void addIpAddress(String ip) {
        ipAddresses.add(ip);
        this.updatedAt = Instant.now();
    }

    public String getDeviceFingerprint() {
        return deviceFingerprint;
    }

    public void setDeviceFingerprint(String deviceFingerprint) {
        this.deviceFingerprint = deviceFingerprint;
        this.updatedAt = Instant.now();
    }

    public Map<String, Integer> getBehaviorCounts() {
        return Map.copyOf(behaviorCounts);
    }

    public int incrementBehavior(String behaviorType) {
        this.updatedAt = Instant.now();
        return behaviorCounts.merge(behaviorType, 1, Integer::sum);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Folds another profile into this one. Sites and IPs are unioned, behavior counts summed,
     * and contact fields filled only where this profile has none.
     */
    public void absorb(Profile other, Instant at) {
        sitesVisited.addAll(other.sitesVisited);
        ipAddresses.addAll(other.ipAddresses);
        other.behaviorCounts.forEach((type, count) -> behaviorCounts.merge(type, count, Integer::sum));
        if (email == null) email = other.email;
        if (phone == null) phone = other.phone;
        if (name == null) name = other.name;
        if (company == null) company = other.company;
        if (deviceFingerprint == null) deviceFingerprint = other.deviceFingerprint;
        this.updatedAt = at;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Profile profile = (Profile) o;
        return Objects.equals(id, profile.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Profile{" +
                "id='" + id + '\'' +
                ", profileHash='" + profileHash + '\'' +
                ", email='" + email + '\'' +
                ", company='" + company + '\'' +
                ", sites=" + sitesVisited.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Profile profile) {
        return new Builder()
                .id(profile.id)
                .profileHash(profile.profileHash)
                .email(profile.email)
                .phone(profile.phone)
                .name(profile.name)
                .company(profile.company)
                .sitesVisited(profile.sitesVisited)
                .ipAddresses(profile.ipAddresses)
                .deviceFingerprint(profile.deviceFingerprint)
                .behaviorCounts(profile.behaviorCounts)
                .createdAt(profile.createdAt)
                .updatedAt(profile.updatedAt);
    }

    public static class Builder {
        private String id;
        private String profileHash;
        private String email;
        private String phone;
        private String name;
        private String company;
        private Set<String> sitesVisited = Set.of();
        private Set<String> ipAddresses = Set.of();
        private String deviceFingerprint;
        private Map<String, Integer> behaviorCounts = Map.of();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder profileHash(String profileHash) {
            this.profileHash = profileHash;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder sitesVisited(Set<String> sitesVisited) {
            this.sitesVisited = sitesVisited != null ? sitesVisited : Set.of();
            return this;
        }

        public Builder ipAddresses(Set<String> ipAddresses) {
            this.ipAddresses = ipAddresses != null ? ipAddresses : Set.of();
            return this;
        }

        public Builder deviceFingerprint(String deviceFingerprint) {
            this.deviceFingerprint = deviceFingerprint;
            return this;
        }

        public Builder behaviorCounts(Map<String, Integer> behaviorCounts) {
            this.behaviorCounts = behaviorCounts != null ? behaviorCounts : Map.of();
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Profile build() {
            Objects.requireNonNull(profileHash, "profileHash is required");
            return new Profile(this);
        }
    }
}
