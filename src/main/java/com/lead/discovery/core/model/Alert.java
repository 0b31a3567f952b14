package com.lead.discovery.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A persisted notification about a lead. Status changes go through
 * {@link AlertStatus#canTransitionTo(AlertStatus)}.
 */
public class Alert {
    private final String id;
    private final String leadId;
    private final AlertType alertType;
    private final String title;
    private final String message;
    private final Priority priority;
    private final Map<String, Object> data;
    private AlertStatus status;
    private final Set<String> ruleIds;
    private final Instant createdAt;
    private Instant readAt;
    private Instant actionedAt;
    private Instant dismissedAt;

    private Alert(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.leadId = builder.leadId;
        this.alertType = builder.alertType;
        this.title = builder.title;
        this.message = builder.message;
        this.priority = builder.priority;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.status = builder.status != null ? builder.status : AlertStatus.NEW;
        this.ruleIds = new LinkedHashSet<>(builder.ruleIds);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.readAt = builder.readAt;
        this.actionedAt = builder.actionedAt;
        this.dismissedAt = builder.dismissedAt;
    }

    public String getId() {
        return id;
    }

    public String getLeadId() {
        return leadId;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public Priority getPriority() {
        return priority;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Set<String> getRuleIds() {
        return Set.copyOf(ruleIds);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getReadAt() {
        return readAt;
    }

    public Instant getActionedAt() {
        return actionedAt;
    }

    public Instant getDismissedAt() {
        return dismissedAt;
    }

    public void linkRule(String ruleId) {
        ruleIds.add(ruleId);
    }

    /**
     * Moves to the given status and stamps the matching timestamp.
     *
     * @throws IllegalStateException if the lifecycle forbids the change
     */
    public void transitionTo(AlertStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Alert " + id + " cannot move from " + status + " to " + next);
        }
        switch (next) {
            case READ -> readAt = at;
            case ACTIONED -> actionedAt = at;
            case DISMISSED -> dismissedAt = at;
        }
        this.status = next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Alert alert = (Alert) o;
        return Objects.equals(id, alert.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", leadId='" + leadId + '\'' +
                ", alertType=" + alertType +
                ", title='" + title + '\'' +
                ", priority=" + priority +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Alert alert) {
        return new Builder()
                .id(alert.id)
                .leadId(alert.leadId)
                .alertType(alert.alertType)
                .title(alert.title)
                .message(alert.message)
                .priority(alert.priority)
                .data(alert.data)
                .status(alert.status)
                .ruleIds(alert.ruleIds)
                .createdAt(alert.createdAt)
                .readAt(alert.readAt)
                .actionedAt(alert.actionedAt)
                .dismissedAt(alert.dismissedAt);
    }

    public static class Builder {
        private String id;
        private String leadId;
        private AlertType alertType;
        private String title;
        private String message;
        private Priority priority = Priority.MEDIUM;
        private Map<String, Object> data = Map.of();
        private AlertStatus status;
        private Set<String> ruleIds = Set.of();
        private Instant createdAt;
        private Instant readAt;
        private Instant actionedAt;
        private Instant dismissedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder leadId(String leadId) {
            this.leadId = leadId;
            return this;
        }

        public Builder alertType(AlertType alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority != null ? priority : Priority.MEDIUM;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data != null ? data : Map.of();
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder ruleIds(Set<String> ruleIds) {
            this.ruleIds = ruleIds != null ? ruleIds : Set.of();
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder readAt(Instant readAt) {
            this.readAt = readAt;
            return this;
        }

        public Builder actionedAt(Instant actionedAt) {
            this.actionedAt = actionedAt;
            return this;
        }

        public Builder dismissedAt(Instant dismissedAt) {
            this.dismissedAt = dismissedAt;
            return this;
        }

        public Alert build() {
            Objects.requireNonNull(alertType, "alertType is required");
            Objects.requireNonNull(title, "title is required");
            return new Alert(this);
        }
    }
}
