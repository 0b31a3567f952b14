package com.lead.discovery.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Scored pairing of a lead and a service offering, keyed by (leadId, serviceId).
 * Scores, reasons, confidence and priority are owned by the scorer; status and notes
 * are owned by whoever follows the match up and survive re-scoring.
 */
public class Match {
    private final String id;
    private final String leadId;
    private final String serviceId;
    private double matchScore;
    private double geographicScore;
    private double industryScore;
    private double needScore;
    private double profileScore;
    private double behavioralScore;
    private ConfidenceLevel confidenceLevel;
    private Priority priority;
    private List<String> reasons;
    private MatchStatus status;
    private String notes;
    private final List<MatchHistoryEntry> history;
    private final Instant createdAt;
    private Instant updatedAt;

    private Match(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.leadId = builder.leadId;
        this.serviceId = builder.serviceId;
        this.matchScore = builder.matchScore;
        this.geographicScore = builder.geographicScore;
        this.industryScore = builder.industryScore;
        this.needScore = builder.needScore;
        this.profileScore = builder.profileScore;
        this.behavioralScore = builder.behavioralScore;
        this.confidenceLevel = builder.confidenceLevel;
        this.priority = builder.priority;
        this.reasons = List.copyOf(builder.reasons);
        this.status = builder.status != null ? builder.status : MatchStatus.PENDING;
        this.notes = builder.notes;
        this.history = new ArrayList<>(builder.history);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getLeadId() {
        return leadId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public double getMatchScore() {
        return matchScore;
    }

    public double getGeographicScore() {
        return geographicScore;
    }

    public double getIndustryScore() {
        return industryScore;
    }

    public double getNeedScore() {
        return needScore;
    }

    public double getProfileScore() {
        return profileScore;
    }

    public double getBehavioralScore() {
        return behavioralScore;
    }

    public ConfidenceLevel getConfidenceLevel() {
        return confidenceLevel;
    }

    public Priority getPriority() {
        return priority;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public MatchStatus getStatus() {
        return status;
    }

    public String getNotes() {
        return notes;
    }

    public List<MatchHistoryEntry> getHistory() {
        return List.copyOf(history);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Copies the scorer-owned fields of a fresh computation onto this match,
     * leaving status, notes and history untouched. updatedAt becomes the computation's timestamp.
     */
    public void refreshScores(Match recomputed) {
        this.matchScore = recomputed.matchScore;
        this.geographicScore = recomputed.geographicScore;
        this.industryScore = recomputed.industryScore;
        this.needScore = recomputed.needScore;
        this.profileScore = recomputed.profileScore;
        this.behavioralScore = recomputed.behavioralScore;
        this.confidenceLevel = recomputed.confidenceLevel;
        this.priority = recomputed.priority;
        this.reasons = recomputed.reasons;
        this.updatedAt = recomputed.updatedAt;
    }

    /**
     * Changes the follow-up status. Null notes keep the existing notes.
     */
    public void updateStatus(MatchStatus status, String notes, Instant at) {
        this.status = Objects.requireNonNull(status, "status is required");
        if (notes != null) {
            this.notes = notes;
        }
        this.updatedAt = at;
        history.add(new MatchHistoryEntry(status, notes, updatedAt));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Match match = (Match) o;
        return Objects.equals(leadId, match.leadId) && Objects.equals(serviceId, match.serviceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leadId, serviceId);
    }

    @Override
    public String toString() {
        return "Match{" +
                "id='" + id + '\'' +
                ", leadId='" + leadId + '\'' +
                ", serviceId='" + serviceId + '\'' +
                ", matchScore=" + matchScore +
                ", confidenceLevel=" + confidenceLevel +
                ", priority=" + priority +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Match match) {
        return new Builder()
                .id(match.id)
                .leadId(match.leadId)
                .serviceId(match.serviceId)
                .matchScore(match.matchScore)
                .geographicScore(match.geographicScore)
                .industryScore(match.industryScore)
                .needScore(match.needScore)
                .profileScore(match.profileScore)
                .behavioralScore(match.behavioralScore)
                .confidenceLevel(match.confidenceLevel)
                .priority(match.priority)
                .reasons(match.reasons)
                .status(match.status)
                .notes(match.notes)
                .history(match.history)
                .createdAt(match.createdAt)
                .updatedAt(match.updatedAt);
    }

    public static class Builder {
        private String id;
        private String leadId;
        private String serviceId;
        private double matchScore;
        private double geographicScore;
        private double industryScore;
        private double needScore;
        private double profileScore;
        private double behavioralScore;
        private ConfidenceLevel confidenceLevel = ConfidenceLevel.LOW;
        private Priority priority = Priority.LOW;
        private List<String> reasons = List.of();
        private MatchStatus status;
        private String notes;
        private List<MatchHistoryEntry> history = List.of();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder leadId(String leadId) {
            this.leadId = leadId;
            return this;
        }

        public Builder serviceId(String serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder matchScore(double matchScore) {
            this.matchScore = matchScore;
            return this;
        }

        public Builder geographicScore(double geographicScore) {
            this.geographicScore = geographicScore;
            return this;
        }

        public Builder industryScore(double industryScore) {
            this.industryScore = industryScore;
            return this;
        }

        public Builder needScore(double needScore) {
            this.needScore = needScore;
            return this;
        }

        public Builder profileScore(double profileScore) {
            this.profileScore = profileScore;
            return this;
        }

        public Builder behavioralScore(double behavioralScore) {
            this.behavioralScore = behavioralScore;
            return this;
        }

        public Builder confidenceLevel(ConfidenceLevel confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder reasons(List<String> reasons) {
            this.reasons = reasons != null ? reasons : List.of();
            return this;
        }

        public Builder status(MatchStatus status) {
            this.status = status;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder history(List<MatchHistoryEntry> history) {
            this.history = history != null ? history : List.of();
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

        public Match build() {
            Objects.requireNonNull(leadId, "leadId is required");
            Objects.requireNonNull(serviceId, "serviceId is required");
            requireScore("matchScore", matchScore);
            requireScore("geographicScore", geographicScore);
            requireScore("industryScore", industryScore);
            requireScore("needScore", needScore);
            requireScore("profileScore", profileScore);
            requireScore("behavioralScore", behavioralScore);
            return new Match(this);
        }

        private static void requireScore(String name, double value) {
            if (value < 0.0 || value > 100.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(name + " must be in [0,100]: " + value);
            }
        }
    }
}
