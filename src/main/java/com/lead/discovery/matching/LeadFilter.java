package com.lead.discovery.matching;

import com.lead.discovery.core.model.Lead;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Filters applied when ranking leads for a service. Location and industry are
 * case-insensitive substring checks; lost and invalid leads are always excluded.
 */
public class LeadFilter {

    private final Double minMatchScore;
    private final String location;
    private final String industry;
    private final Set<String> needs;

    private LeadFilter(Builder builder) {
        this.minMatchScore = builder.minMatchScore;
        this.location = lower(builder.location);
        this.industry = lower(builder.industry);
        this.needs = builder.needs;
    }

    public static LeadFilter none() {
        return builder().build();
    }

    public Double getMinMatchScore() {
        return minMatchScore;
    }

    public String getLocation() {
        return location;
    }

    public String getIndustry() {
        return industry;
    }

    public Set<String> getNeeds() {
        return needs;
    }

    /**
     * Lead-side checks. The score bound is applied separately since it needs the stored match.
     */
    public boolean test(Lead lead) {
        if (!lead.isEligibleForMatching()) {
            return false;
        }
        if (location != null && !contains(lead.getCity(), location) && !contains(lead.getState(), location)) {
            return false;
        }
        if (industry != null && !contains(lead.getIndustry(), industry)) {
            return false;
        }
        return needs.isEmpty() || lead.getNeedsIdentified().stream().anyMatch(needs::contains);
    }

    /**
     * Unscored leads always pass; they are scored during ranking.
     */
    public boolean acceptsScore(Double score) {
        return minMatchScore == null || score == null || score >= minMatchScore;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String lower(String value) {
        return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Double minMatchScore;
        private String location;
        private String industry;
        private Set<String> needs = Set.of();

        public Builder minMatchScore(Double minMatchScore) {
            this.minMatchScore = minMatchScore;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder needs(Collection<String> needs) {
            this.needs = needs != null ? Set.copyOf(needs) : Set.of();
            return this;
        }

        public LeadFilter build() {
            if (minMatchScore != null && (minMatchScore < 0 || minMatchScore > 100)) {
                throw new IllegalArgumentException("minMatchScore must be in [0,100]");
            }
            return new LeadFilter(this);
        }
    }
}
