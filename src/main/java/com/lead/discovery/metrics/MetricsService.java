package com.lead.discovery.metrics;

import com.lead.discovery.core.model.AlertType;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.core.model.Priority;

import java.time.Duration;

/**
 * Hook for engine metrics. {@link NoOpMetricsService} is the default so the engine
 * runs without any metrics library on the classpath.
 */
public interface MetricsService {

    void incrementIdentifierTracked(IdentifierType type, boolean created);

    void incrementProfileCreated();

    void incrementProfileMerged();

    void recordMatchScore(double score);

    void recordMatchingDuration(Duration duration);

    void incrementAlertEmitted(AlertType type, Priority priority);

    void recordDiscoveryDuration(Duration duration);

    void incrementDiscoveryFailure(String source);

    void recordCacheHit();

    void recordCacheMiss();
}
