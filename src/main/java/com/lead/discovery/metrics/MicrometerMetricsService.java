package com.lead.discovery.metrics;

import com.lead.discovery.core.model.AlertType;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.core.model.Priority;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-backed {@link MetricsService}. Needs {@code micrometer-core} at runtime.
 *
 * <ul>
 *   <li>{@code lead.identifier.tracked} counter (tags: type, outcome)</li>
 *   <li>{@code lead.profile.created} and {@code lead.profile.merged} counters</li>
 *   <li>{@code lead.match.score} distribution summary</li>
 *   <li>{@code lead.match.duration} and {@code lead.discovery.duration} timers</li>
 *   <li>{@code lead.alert.emitted} counter (tags: type, priority)</li>
 *   <li>{@code lead.discovery.failure} counter (tag: source)</li>
 *   <li>{@code lead.catalog.cache.hit} and {@code lead.catalog.cache.miss} counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter profileCreatedCounter;
    private final Counter profileMergedCounter;
    private final DistributionSummary matchScoreSummary;
    private final Timer matchingTimer;
    private final Timer discoveryTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.profileCreatedCounter = Counter.builder("lead.profile.created")
                .description("Profiles created from identifier sets")
                .register(registry);
        this.profileMergedCounter = Counter.builder("lead.profile.merged")
                .description("Profiles merged into a survivor")
                .register(registry);
        this.matchScoreSummary = DistributionSummary.builder("lead.match.score")
                .description("Distribution of lead to service match scores")
                .register(registry);
        this.matchingTimer = Timer.builder("lead.match.duration")
                .description("Time spent scoring one lead against the catalog")
                .register(registry);
        this.discoveryTimer = Timer.builder("lead.discovery.duration")
                .description("Time spent on one discovery batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("lead.catalog.cache.hit")
                .description("Service catalog cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("lead.catalog.cache.miss")
                .description("Service catalog cache misses")
                .register(registry);
    }

    @Override
    public void incrementIdentifierTracked(IdentifierType type, boolean created) {
        String outcome = created ? "created" : "seen";
        counter("tracked:" + type.name() + ":" + outcome, () ->
                Counter.builder("lead.identifier.tracked")
                        .description("Identifier observations")
                        .tag("type", type.code())
                        .tag("outcome", outcome)
                        .register(registry)).increment();
    }

    @Override
    public void incrementProfileCreated() {
        profileCreatedCounter.increment();
    }

    @Override
    public void incrementProfileMerged() {
        profileMergedCounter.increment();
    }

    @Override
    public void recordMatchScore(double score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void recordMatchingDuration(Duration duration) {
        matchingTimer.record(duration);
    }

    @Override
    public void incrementAlertEmitted(AlertType type, Priority priority) {
        counter("alert:" + type.name() + ":" + priority.name(), () ->
                Counter.builder("lead.alert.emitted")
                        .description("Alerts persisted")
                        .tag("type", type.code())
                        .tag("priority", priority.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordDiscoveryDuration(Duration duration) {
        discoveryTimer.record(duration);
    }

    @Override
    public void incrementDiscoveryFailure(String source) {
        counter("discoveryFailure:" + source, () ->
                Counter.builder("lead.discovery.failure")
                        .description("Discovery tasks that failed or timed out")
                        .tag("source", source)
                        .register(registry)).increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
