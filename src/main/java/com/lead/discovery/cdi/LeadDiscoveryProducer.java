package com.lead.discovery.cdi;

import com.lead.discovery.alert.AlertDispatcher;
import com.lead.discovery.alert.AlertNotifier;
import com.lead.discovery.api.EngineOptions;
import com.lead.discovery.api.LeadDiscoveryEngine;
import com.lead.discovery.cache.CacheConfig;
import com.lead.discovery.catalog.ServiceCatalog;
import com.lead.discovery.lead.BusinessDirectory;
import com.lead.discovery.matching.MatchingWeights;
import com.lead.discovery.matching.Matchmaker;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.privacy.PrivacyMode;
import com.lead.discovery.privacy.PrivacyPolicy;
import com.lead.discovery.retention.RetentionPolicy;
import com.lead.discovery.tracing.TracingService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * CDI producer that wires the lead discovery engine from MicroProfile Config properties.
 *
 * <p>Business directories, a service catalog, alert notifiers and metrics/tracing services
 * found in the container are picked up automatically.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * lead-discovery.store=falkordb
 * lead-discovery.falkordb.host=localhost
 * lead-discovery.falkordb.port=6379
 * lead-discovery.falkordb.graph-name=lead-discovery
 * lead-discovery.privacy.mode=standard
 * </pre>
 * With {@code lead-discovery.store=memory} no graph store is needed.
 */
@ApplicationScoped
public class LeadDiscoveryProducer {

    private static final Logger log = LoggerFactory.getLogger(LeadDiscoveryProducer.class);

    static final String STORE_FALKORDB = "falkordb";
    static final String STORE_MEMORY = "memory";

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lead-discovery.store", defaultValue = STORE_FALKORDB)
    String store;

    @Inject
    @ConfigProperty(name = "lead-discovery.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "lead-discovery.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "lead-discovery.falkordb.graph-name", defaultValue = "lead-discovery")
    String falkordbGraphName;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lead-discovery.matching.weights", defaultValue = "default")
    String weightsProfile;

    @Inject
    @ConfigProperty(name = "lead-discovery.matching.alert-threshold", defaultValue = "75")
    double alertThreshold;

    @Inject
    @ConfigProperty(name = "lead-discovery.matching.top-n", defaultValue = "5")
    int topN;

    // ── Discovery ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lead-discovery.discovery.max-concurrency", defaultValue = "4")
    int maxConcurrency;

    @Inject
    @ConfigProperty(name = "lead-discovery.discovery.timeout-ms", defaultValue = "10000")
    long discoveryTimeoutMs;

    @Inject
    @ConfigProperty(name = "lead-discovery.geo.default-country", defaultValue = "US")
    String defaultCountry;

    @Inject
    @ConfigProperty(name = "lead-discovery.profiles.min-shared-identifiers", defaultValue = "2")
    int minSharedIdentifiers;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lead-discovery.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "lead-discovery.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "lead-discovery.cache.ttl-seconds", defaultValue = "60")
    int cacheTtlSeconds;

    // ── Privacy ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lead-discovery.privacy.mode", defaultValue = "standard")
    String privacyMode;

    @Inject
    @ConfigProperty(name = "lead-discovery.privacy.require-consent", defaultValue = "true")
    boolean requireConsent;

    @Inject
    @ConfigProperty(name = "lead-discovery.privacy.anonymize-data", defaultValue = "true")
    boolean anonymizeData;

    @Inject
    @ConfigProperty(name = "lead-discovery.privacy.cross-site-tracking", defaultValue = "false")
    boolean crossSiteTracking;

    @Inject
    @ConfigProperty(name = "lead-discovery.privacy.fingerprinting", defaultValue = "false")
    boolean fingerprinting;

    // ── Retention ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lead-discovery.retention.alert-days", defaultValue = "90")
    int alertRetentionDays;

    @Inject
    @ConfigProperty(name = "lead-discovery.retention.audit-days", defaultValue = "2555")
    int auditRetentionDays;

    @Inject
    @ConfigProperty(name = "lead-discovery.retention.identifiers-enabled", defaultValue = "true")
    boolean identifierRetentionEnabled;

    // ── Collaborators ─────────────────────────────────────────

    @Inject
    Instance<BusinessDirectory> directories;

    @Inject
    Instance<ServiceCatalog> serviceCatalog;

    @Inject
    Instance<AlertNotifier> notifiers;

    @Inject
    Instance<MetricsService> metricsService;

    @Inject
    Instance<TracingService> tracingService;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public LeadDiscoveryEngine leadDiscoveryEngine() {
        EngineOptions options = engineOptions();
        LeadDiscoveryEngine.Builder builder = LeadDiscoveryEngine.builder().options(options);

        if (STORE_MEMORY.equalsIgnoreCase(store)) {
            log.info("Producing LeadDiscoveryEngine: store=memory");
        } else {
            if (!STORE_FALKORDB.equalsIgnoreCase(store)) {
                log.warn("Unknown store '{}', falling back to {}", store, STORE_FALKORDB);
            }
            log.info("Producing LeadDiscoveryEngine: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            builder.falkorDB(falkordbHost, falkordbPort, falkordbGraphName);
        }

        directories.forEach(builder::directory);
        notifiers.forEach(builder::notifier);
        if (serviceCatalog.isResolvable()) {
            builder.serviceCatalog(serviceCatalog.get());
        } else {
            log.warn("No ServiceCatalog bean found; matching runs against an empty catalog");
        }
        if (metricsService.isResolvable()) {
            builder.metricsService(metricsService.get());
        }
        if (tracingService.isResolvable()) {
            builder.tracingService(tracingService.get());
        }
        return builder.build();
    }

    public void closeEngine(@Disposes LeadDiscoveryEngine engine) {
        log.info("Closing LeadDiscoveryEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public Matchmaker matchmaker(LeadDiscoveryEngine engine) {
        return engine.matching();
    }

    @Produces
    @ApplicationScoped
    public AlertDispatcher alertDispatcher(LeadDiscoveryEngine engine) {
        return engine.alerts();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    EngineOptions engineOptions() {
        PrivacyPolicy privacy = PrivacyPolicy.builder()
                .mode(PrivacyMode.parse(privacyMode))
                .requireConsent(requireConsent)
                .anonymizeData(anonymizeData)
                .crossSiteTrackingEnabled(crossSiteTracking)
                .fingerprintingEnabled(fingerprinting)
                .build();

        RetentionPolicy retention = RetentionPolicy.builder()
                .alertRetention(Duration.ofDays(alertRetentionDays))
                .auditRetention(Duration.ofDays(auditRetentionDays))
                .identifiersEnabled(identifierRetentionEnabled)
                .build();

        CacheConfig cache = cacheEnabled
                ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                : CacheConfig.disabled();

        return EngineOptions.builder()
                .matchingWeights(weights(weightsProfile))
                .alertThreshold(alertThreshold)
                .topN(topN)
                .maxConcurrency(maxConcurrency)
                .discoveryTimeoutMs(discoveryTimeoutMs)
                .defaultCountry(defaultCountry)
                .minSharedIdentifiers(minSharedIdentifiers)
                .catalogCache(cache)
                .privacyPolicy(privacy)
                .retentionPolicy(retention)
                .build();
    }

    static MatchingWeights weights(String profile) {
        String key = profile == null ? "" : profile.trim().toLowerCase(Locale.ROOT);
        if (key.equals("need-focused") || key.equals("need_focused")) {
            return MatchingWeights.needFocused();
        }
        if (!key.isEmpty() && !key.equals("default")) {
            log.warn("Unknown matching weights '{}', using default", profile);
        }
        return MatchingWeights.defaultWeights();
    }
}
