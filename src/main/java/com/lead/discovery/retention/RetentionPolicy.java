package com.lead.discovery.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for data retention sweeps.
 * Identifier retention is not configured here: it follows the active privacy mode.
 *
 * @param alertRetention     how long to keep actioned or dismissed alerts
 * @param auditRetention     how long to keep audit entries
 * @param identifiersEnabled whether unlinked identifiers are swept
 */
public record RetentionPolicy(
        Duration alertRetention,
        Duration auditRetention,
        boolean identifiersEnabled
) {
    public RetentionPolicy {
        Objects.requireNonNull(alertRetention, "alertRetention is required");
        Objects.requireNonNull(auditRetention, "auditRetention is required");
        if (alertRetention.isNegative()) {
            throw new IllegalArgumentException("alertRetention must not be negative");
        }
        if (auditRetention.isNegative()) {
            throw new IllegalArgumentException("auditRetention must not be negative");
        }
    }

    /**
     * Creates a default retention policy.
     * - Resolved alerts: 90 days
     * - Audit entries: 7 years (compliance)
     * - Identifier sweep enabled
     */
    public static RetentionPolicy defaults() {
        return new RetentionPolicy(Duration.ofDays(90), Duration.ofDays(2555), true);
    }

    /**
     * Creates a policy that keeps everything.
     */
    public static RetentionPolicy noExpiration() {
        return new RetentionPolicy(Duration.ofDays(36500), Duration.ofDays(36500), false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration alertRetention = Duration.ofDays(90);
        private Duration auditRetention = Duration.ofDays(2555);
        private boolean identifiersEnabled = true;

        public Builder alertRetention(Duration duration) {
            this.alertRetention = duration;
            return this;
        }

        public Builder auditRetention(Duration duration) {
            this.auditRetention = duration;
            return this;
        }

        public Builder identifiersEnabled(boolean enabled) {
            this.identifiersEnabled = enabled;
            return this;
        }

        public RetentionPolicy build() {
            return new RetentionPolicy(alertRetention, auditRetention, identifiersEnabled);
        }
    }
}
