package com.lead.discovery.metrics;

import com.lead.discovery.core.model.AlertType;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.core.model.Priority;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementIdentifierTracked(IdentifierType type, boolean created) {
    }

    @Override
    public void incrementProfileCreated() {
    }

    @Override
    public void incrementProfileMerged() {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void recordMatchingDuration(Duration duration) {
    }

    @Override
    public void incrementAlertEmitted(AlertType type, Priority priority) {
    }

    @Override
    public void recordDiscoveryDuration(Duration duration) {
    }

    @Override
    public void incrementDiscoveryFailure(String source) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
