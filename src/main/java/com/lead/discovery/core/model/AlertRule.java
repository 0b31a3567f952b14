package com.lead.discovery.core.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Rule evaluated against every alert of its type. All conditions must hold.
 */
public final class AlertRule {
    private final String id;
    private final String ruleName;
    private final AlertType ruleType;
    private final List<RuleCondition> conditions;
    private final Set<AlertChannel> channels;
    private final List<String> recipients;
    private final String webhookUrl;
    private final Priority priority;
    private final boolean active;
    private final Instant createdAt;

    private AlertRule(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.ruleName = builder.ruleName;
        this.ruleType = builder.ruleType;
        this.conditions = List.copyOf(builder.conditions);
        this.channels = builder.channels.isEmpty()
                ? Set.of(AlertChannel.DASHBOARD) : Set.copyOf(builder.channels);
        this.recipients = List.copyOf(builder.recipients);
        this.webhookUrl = builder.webhookUrl;
        this.priority = builder.priority;
        this.active = builder.active;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getRuleName() {
        return ruleName;
    }

    public AlertType getRuleType() {
        return ruleType;
    }

    public List<RuleCondition> getConditions() {
        return conditions;
    }

    public Set<AlertChannel> getChannels() {
        return channels;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public Priority getPriority() {
        return priority;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean matches(Map<String, Object> data) {
        return conditions.stream().allMatch(c -> c.test(data));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AlertRule that = (AlertRule) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", ruleName='" + ruleName + '\'' +
                ", ruleType=" + ruleType +
                ", conditions=" + conditions.size() +
                ", channels=" + channels +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String ruleName;
        private AlertType ruleType;
        private List<RuleCondition> conditions = List.of();
        private Set<AlertChannel> channels = EnumSet.noneOf(AlertChannel.class);
        private List<String> recipients = List.of();
        private String webhookUrl;
        private Priority priority = Priority.MEDIUM;
        private boolean active = true;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder ruleType(AlertType ruleType) {
            this.ruleType = ruleType;
            return this;
        }

        public Builder conditions(List<RuleCondition> conditions) {
            this.conditions = conditions != null ? conditions : List.of();
            return this;
        }

        /**
         * Parses conditions from their key form, e.g. {@code min_match_score -> 90}.
         */
        public Builder conditions(Map<String, ?> conditions) {
            this.conditions = RuleCondition.parseAll(conditions);
            return this;
        }

        public Builder channels(Set<AlertChannel> channels) {
            this.channels = channels != null ? channels : EnumSet.noneOf(AlertChannel.class);
            return this;
        }

        public Builder recipients(List<String> recipients) {
            this.recipients = recipients != null ? recipients : List.of();
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority != null ? priority : Priority.MEDIUM;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AlertRule build() {
            Objects.requireNonNull(ruleName, "ruleName is required");
            Objects.requireNonNull(ruleType, "ruleType is required");
            return new AlertRule(this);
        }
    }
}
