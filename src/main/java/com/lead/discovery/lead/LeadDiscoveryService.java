package com.lead.discovery.lead;

import com.lead.discovery.core.model.Lead;
import com.lead.discovery.geo.GeographicIndex;
import com.lead.discovery.geo.ParsedLocation;
import com.lead.discovery.logging.LogContext;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.tracing.Span;
import com.lead.discovery.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Discovers business leads by fanning out one call per directory and criterion
 * (area, industry, keywords) on a bounded pool.
 *
 * <p>Every call runs under a timeout; a call still running when it expires is interrupted.
 * A failed or timed-out call is reported in the
 * {@link DiscoveryResult} and the rest of the batch carries on. Listings returned by several
 * calls become a single lead.</p>
 */
public class LeadDiscoveryService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeadDiscoveryService.class);

    public static final long DEFAULT_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_MAX_CONCURRENCY = 4;

    private final List<BusinessDirectory> directories;
    private final LeadBuilder leadBuilder;
    private final GeographicIndex geographicIndex;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService executor;
    private final Semaphore permits;
    private final long timeoutMs;

    public LeadDiscoveryService(List<BusinessDirectory> directories, LeadBuilder leadBuilder,
                                GeographicIndex geographicIndex, MetricsService metricsService,
                                TracingService tracingService, int maxConcurrency, long timeoutMs) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.directories = List.copyOf(directories);
        this.leadBuilder = leadBuilder;
        this.geographicIndex = geographicIndex;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.executor = Executors.newFixedThreadPool(maxConcurrency);
        this.permits = new Semaphore(maxConcurrency);
        this.timeoutMs = timeoutMs;
    }

    /**
     * Runs one discovery batch and waits for it.
     *
     * @throws com.lead.discovery.core.exception.ValidationException if the geographic area is malformed
     */
    public DiscoveryResult discoverLeads(DiscoveryCriteria criteria) {
        String batchId = LogContext.generateCorrelationId();
        Instant start = Instant.now();
        // parse up front so a malformed area fails the call instead of every task
        ParsedLocation area = criteria.hasGeographicArea()
                ? geographicIndex.parseLocation(criteria.getGeographicArea())
                : null;

        try (LogContext ignored = LogContext.forDiscovery(batchId);
             Span span = tracingService.startSpan("discover", Map.of("batchId", batchId))) {
            List<DirectoryTask> tasks = submitTasks(criteria, area);
            log.info("discovery.started batchId={} directories={} tasks={}",
                    batchId, directories.size(), tasks.size());

            Map<String, BusinessListing> listings = new LinkedHashMap<>();
            List<String> errors = new ArrayList<>();
            int failed = 0;
            for (DirectoryTask task : tasks) {
                try {
                    for (BusinessListing listing : task.future().join()) {
                        listings.putIfAbsent(dedupeKey(listing), listing);
                    }
                } catch (CompletionException e) {
                    failed++;
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    String reason = cause instanceof TimeoutException
                            ? "timed out after " + timeoutMs + "ms"
                            : cause.getMessage();
                    errors.add(task.label() + ": " + reason);
                    metricsService.incrementDiscoveryFailure(task.directory());
                    log.warn("discovery.task.failed batchId={} task={} reason={}", batchId, task.label(), reason);
                }
            }

            List<String> leadIds = new ArrayList<>();
            for (BusinessListing listing : listings.values()) {
                try {
                    Lead lead = leadBuilder.createBusinessLead(listing, criteria.getLeadCategory());
                    leadIds.add(lead.getId());
                } catch (RuntimeException e) {
                    errors.add("listing " + listing.getBusinessName() + ": " + e.getMessage());
                    log.warn("discovery.listing.failed batchId={} business={} error={}",
                            batchId, listing.getBusinessName(), e.getMessage());
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            metricsService.recordDiscoveryDuration(duration);
            span.setAttribute("leads", leadIds.size());
            span.setAttribute("failedTasks", failed);
            span.setStatus(failed == tasks.size() && !tasks.isEmpty() ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
            log.info("discovery.completed batchId={} leads={} failedTasks={} errors={} durationMs={}",
                    batchId, leadIds.size(), failed, errors.size(), duration.toMillis());
            return new DiscoveryResult(batchId, leadIds, errors, tasks.size(), failed, duration);
        }
    }

    public CompletableFuture<DiscoveryResult> discoverLeadsAsync(DiscoveryCriteria criteria) {
        return CompletableFuture.supplyAsync(() -> discoverLeads(criteria));
    }

    private List<DirectoryTask> submitTasks(DiscoveryCriteria criteria, ParsedLocation area) {
        List<DirectoryTask> tasks = new ArrayList<>();
        for (BusinessDirectory directory : directories) {
            if (area != null) {
                tasks.add(submit(directory, "area", () -> geographicIndex.findInRadius(area,
                        criteria.getRadiusKm(), directory.findNear(area, criteria.getRadiusKm()))));
            }
            if (criteria.hasIndustry()) {
                tasks.add(submit(directory, "industry", () -> directory.findByIndustry(criteria.getIndustry())));
            }
            if (criteria.hasKeywords()) {
                tasks.add(submit(directory, "keywords", () -> directory.findByKeywords(criteria.getKeywords())));
            }
        }
        return tasks;
    }

    private DirectoryTask submit(BusinessDirectory directory, String criterion,
                                 Supplier<List<BusinessListing>> call) {
        CompletableFuture<List<BusinessListing>> future = new CompletableFuture<>();
        Future<?> worker = executor.submit(() -> {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.completeExceptionally(e);
                return;
            }
            try {
                List<BusinessListing> found = call.get();
                future.complete(found != null ? found : List.of());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } finally {
                permits.release();
            }
        });
        future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).whenComplete((listings, error) -> {
            if (error instanceof TimeoutException) {
                // interrupt the call so a hung directory does not keep its pool thread
                worker.cancel(true);
            }
        });
        return new DirectoryTask(directory.name(), directory.name() + "/" + criterion, future);
    }

    private static String dedupeKey(BusinessListing listing) {
        return (listing.getBusinessName() + "|" + listing.getCity()).toLowerCase(Locale.ROOT);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record DirectoryTask(String directory, String label,
                                 CompletableFuture<List<BusinessListing>> future) {
    }
}
