package com.lead.discovery.alert;

import com.lead.discovery.core.model.Alert;
import com.lead.discovery.core.model.AlertStatus;
import com.lead.discovery.core.model.AlertType;
import com.lead.discovery.core.model.Priority;

/**
 * Optional status, type and priority filters for alert listings. Unset fields match anything.
 */
public class AlertFilter {
    public static final int DEFAULT_LIMIT = 100;

    private final AlertStatus status;
    private final AlertType alertType;
    private final Priority priority;
    private final int limit;

    private AlertFilter(Builder builder) {
        this.status = builder.status;
        this.alertType = builder.alertType;
        this.priority = builder.priority;
        this.limit = builder.limit;
    }

    public static AlertFilter all() {
        return builder().build();
    }

    public AlertStatus getStatus() {
        return status;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    public Priority getPriority() {
        return priority;
    }

    public int getLimit() {
        return limit;
    }

    public boolean test(Alert alert) {
        return (status == null || alert.getStatus() == status)
                && (alertType == null || alert.getAlertType() == alertType)
                && (priority == null || alert.getPriority() == priority);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AlertStatus status;
        private AlertType alertType;
        private Priority priority;
        private int limit = DEFAULT_LIMIT;

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder alertType(AlertType alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public AlertFilter build() {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be > 0");
            }
            return new AlertFilter(this);
        }
    }
}
