package com.lead.discovery.api;

import com.lead.discovery.alert.AlertDispatcher;
import com.lead.discovery.alert.AlertFilter;
import com.lead.discovery.alert.AlertNotifier;
import com.lead.discovery.alert.AlertRepository;
import com.lead.discovery.alert.AlertRuleRepository;
import com.lead.discovery.alert.GraphAlertRepository;
import com.lead.discovery.alert.InMemoryAlertRepository;
import com.lead.discovery.alert.InMemoryAlertRuleRepository;
import com.lead.discovery.audit.AuditRepository;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.audit.GraphAuditRepository;
import com.lead.discovery.audit.InMemoryAuditRepository;
import com.lead.discovery.catalog.CachingServiceCatalog;
import com.lead.discovery.catalog.InMemoryServiceCatalog;
import com.lead.discovery.catalog.ServiceCatalog;
import com.lead.discovery.core.model.Alert;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.Match;
import com.lead.discovery.geo.GeographicIndex;
import com.lead.discovery.geo.LocationParser;
import com.lead.discovery.graph.FalkorDBConnection;
import com.lead.discovery.graph.GraphConnection;
import com.lead.discovery.identity.GraphIdentifierRepository;
import com.lead.discovery.identity.GraphProfileRepository;
import com.lead.discovery.identity.IdentifierRepository;
import com.lead.discovery.identity.IdentifierStore;
import com.lead.discovery.identity.InMemoryIdentifierRepository;
import com.lead.discovery.identity.InMemoryProfileRepository;
import com.lead.discovery.identity.ProfileRepository;
import com.lead.discovery.identity.ProfileResolver;
import com.lead.discovery.lead.BusinessDirectory;
import com.lead.discovery.lead.DiscoveryCriteria;
import com.lead.discovery.lead.DiscoveryResult;
import com.lead.discovery.lead.GraphLeadRepository;
import com.lead.discovery.lead.InMemoryLeadRepository;
import com.lead.discovery.lead.LeadBuilder;
import com.lead.discovery.lead.LeadDiscoveryService;
import com.lead.discovery.lead.LeadRepository;
import com.lead.discovery.matching.GraphMatchRepository;
import com.lead.discovery.matching.InMemoryMatchRepository;
import com.lead.discovery.matching.LeadFilter;
import com.lead.discovery.matching.MatchRepository;
import com.lead.discovery.matching.MatchingAlgorithm;
import com.lead.discovery.matching.Matchmaker;
import com.lead.discovery.matching.RankedLead;
import com.lead.discovery.merge.MergeResult;
import com.lead.discovery.merge.ProfileMergeEngine;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.metrics.NoOpMetricsService;
import com.lead.discovery.privacy.PrivacyMode;
import com.lead.discovery.privacy.PrivacyPolicy;
import com.lead.discovery.retention.RetentionPolicy;
import com.lead.discovery.retention.RetentionResult;
import com.lead.discovery.retention.RetentionService;
import com.lead.discovery.signal.SignalDetector;
import com.lead.discovery.tracing.NoOpTracingService;
import com.lead.discovery.tracing.TracingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main entry point for the lead discovery library.
 * Wires the identifier store, profile resolver, signal detector, geographic index,
 * lead builder, matching engine and alert dispatcher over one set of repositories.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * LeadDiscoveryEngine engine = LeadDiscoveryEngine.builder()
 *     .serviceCatalog(catalog)
 *     .directory(directory)
 *     .build();
 *
 * DiscoveryResult discovered = engine.discoverLeads(DiscoveryCriteria.builder()
 *     .geographicArea("Austin, TX")
 *     .industry("technology")
 *     .build());
 *
 * for (String leadId : discovered.leadIds()) {
 *     engine.matchLeadToServices(leadId);
 * }
 * </pre>
 *
 * <p>Without a graph connection every repository is in-memory. With one, the graph is
 * the system of record and nothing authoritative is kept in process.</p>
 */
public class LeadDiscoveryEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeadDiscoveryEngine.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final EngineOptions options;
    private final AtomicReference<PrivacyPolicy> privacyPolicy;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final AuditService auditService;
    private final IdentifierStore identifierStore;
    private final ProfileResolver profileResolver;
    private final SignalDetector signalDetector;
    private final GeographicIndex geographicIndex;
    private final LeadBuilder leadBuilder;
    private final LeadDiscoveryService discoveryService;
    private final Matchmaker matchmaker;
    private final AlertDispatcher alertDispatcher;
    private final RetentionService retentionService;
    private final ServiceCatalog serviceCatalog;

    private LeadDiscoveryEngine(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.options = builder.options;
        this.privacyPolicy = new AtomicReference<>(options.getPrivacyPolicy());
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        Clock clock = builder.clock;

        IdentifierRepository identifierRepository;
        ProfileRepository profileRepository;
        LeadRepository leadRepository;
        MatchRepository matchRepository;
        AlertRepository alertRepository;
        AuditRepository auditRepository;
        if (connection != null) {
            if (builder.createIndexes) {
                connection.createIndexes();
            }
            identifierRepository = new GraphIdentifierRepository(connection);
            profileRepository = new GraphProfileRepository(connection);
            leadRepository = new GraphLeadRepository(connection);
            matchRepository = new GraphMatchRepository(connection);
            alertRepository = new GraphAlertRepository(connection);
            auditRepository = new GraphAuditRepository(connection);
        } else {
            identifierRepository = new InMemoryIdentifierRepository();
            profileRepository = new InMemoryProfileRepository();
            leadRepository = new InMemoryLeadRepository();
            matchRepository = new InMemoryMatchRepository();
            alertRepository = new InMemoryAlertRepository();
            auditRepository = new InMemoryAuditRepository();
        }
        AlertRuleRepository ruleRepository = builder.ruleRepository != null
                ? builder.ruleRepository : new InMemoryAlertRuleRepository();

        this.auditService = builder.auditService != null
                ? builder.auditService : new AuditService(auditRepository);

        this.identifierStore = new IdentifierStore(identifierRepository, privacyPolicy::get,
                auditService, metricsService, clock);
        ProfileMergeEngine mergeEngine = new ProfileMergeEngine(profileRepository, identifierRepository,
                leadRepository, auditService, metricsService, tracingService, clock);
        this.profileResolver = new ProfileResolver(identifierStore, identifierRepository, profileRepository,
                mergeEngine, privacyPolicy::get, auditService, metricsService, clock);

        this.signalDetector = new SignalDetector(builder.objectMapper != null
                ? builder.objectMapper : new ObjectMapper());
        this.geographicIndex = new GeographicIndex(new LocationParser(options.getDefaultCountry()));
        this.leadBuilder = new LeadBuilder(leadRepository, signalDetector, geographicIndex, auditService);
        this.discoveryService = new LeadDiscoveryService(builder.directories, leadBuilder, geographicIndex,
                metricsService, tracingService, options.getMaxConcurrency(), options.getDiscoveryTimeoutMs());

        ServiceCatalog catalog = builder.serviceCatalog != null
                ? builder.serviceCatalog : new InMemoryServiceCatalog();
        this.serviceCatalog = options.getCatalogCache().enabled()
                ? new CachingServiceCatalog(catalog, options.getCatalogCache(), metricsService)
                : catalog;

        this.alertDispatcher = new AlertDispatcher(alertRepository, ruleRepository, leadRepository,
                auditService, metricsService, clock);
        builder.notifiers.forEach(alertDispatcher::addNotifier);

        this.matchmaker = new Matchmaker(leadRepository, serviceCatalog, matchRepository,
                new MatchingAlgorithm(options.getMatchingWeights()), alertDispatcher, auditService,
                metricsService, tracingService, options.getAlertThreshold(), clock);

        this.retentionService = new RetentionService(identifierStore, alertRepository, auditService,
                privacyPolicy::get, clock);

        log.info("engine.initialized store={} directories={} privacyMode={} alertThreshold={}",
                connection != null ? connection.getGraphName() : "in-memory",
                builder.directories.size(), privacyPolicy.get().mode(), options.getAlertThreshold());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Facade ==========

    /**
     * Discovers leads from every configured directory.
     */
    public DiscoveryResult discoverLeads(DiscoveryCriteria criteria) {
        return discoveryService.discoverLeads(criteria);
    }

    /**
     * Scores the lead against every active service and persists the top matches.
     */
    public List<Match> matchLeadToServices(String leadId) {
        return matchmaker.matchLeadToServices(leadId, options.getTopN());
    }

    public List<RankedLead> rankLeads(String serviceId, LeadFilter filter, int limit) {
        return matchmaker.rankLeads(serviceId, filter, limit);
    }

    public List<Alert> getAlerts(AlertFilter filter) {
        return alertDispatcher.getAlerts(filter);
    }

    public Lead getLead(String leadId) {
        return leadBuilder.getLead(leadId);
    }

    /**
     * Merges near-duplicate profiles that share at least the configured number of identifiers.
     */
    public List<MergeResult> reconcileDuplicateProfiles() {
        return profileResolver.mergeDuplicates(options.getMinSharedIdentifiers());
    }

    /**
     * Runs the retention sweeps of the configured policy.
     */
    public RetentionResult applyRetention() {
        return retentionService.applyRetention(options.getRetentionPolicy());
    }

    public RetentionResult applyRetention(RetentionPolicy policy) {
        return retentionService.applyRetention(policy);
    }

    // ========== Privacy ==========

    public PrivacyPolicy getPrivacyPolicy() {
        return privacyPolicy.get();
    }

    /**
     * Switches the privacy mode at runtime. Components read the policy on every call,
     * so the change applies to the next operation.
     */
    public void setPrivacyMode(PrivacyMode mode) {
        PrivacyPolicy updated = privacyPolicy.updateAndGet(p -> p.withMode(mode));
        log.info("privacy.mode.changed mode={}", updated.mode());
    }

    public void setPrivacyPolicy(PrivacyPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy is required");
        }
        privacyPolicy.set(policy);
        log.info("privacy.policy.changed mode={}", policy.mode());
    }

    // ========== Components ==========

    public IdentifierStore identifiers() {
        return identifierStore;
    }

    public ProfileResolver profiles() {
        return profileResolver;
    }

    public SignalDetector signals() {
        return signalDetector;
    }

    public GeographicIndex geography() {
        return geographicIndex;
    }

    public LeadBuilder leads() {
        return leadBuilder;
    }

    public Matchmaker matching() {
        return matchmaker;
    }

    public AlertDispatcher alerts() {
        return alertDispatcher;
    }

    public ServiceCatalog serviceCatalog() {
        return serviceCatalog;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    public EngineOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        discoveryService.close();
        if (ownsConnection && connection != null) {
            connection.close();
        }
        log.info("engine.closed");
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private EngineOptions options = EngineOptions.defaults();
        private ServiceCatalog serviceCatalog;
        private final List<BusinessDirectory> directories = new ArrayList<>();
        private final List<AlertNotifier> notifiers = new ArrayList<>();
        private AlertRuleRepository ruleRepository;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();

        /**
         * Uses the graph as system of record. The caller keeps ownership of the connection.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned by the engine and closed with it.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder options(EngineOptions options) {
            this.options = options;
            return this;
        }

        public Builder serviceCatalog(ServiceCatalog serviceCatalog) {
            this.serviceCatalog = serviceCatalog;
            return this;
        }

        public Builder directory(BusinessDirectory directory) {
            this.directories.add(directory);
            return this;
        }

        public Builder directories(List<BusinessDirectory> directories) {
            this.directories.addAll(directories);
            return this;
        }

        public Builder notifier(AlertNotifier notifier) {
            this.notifiers.add(notifier);
            return this;
        }

        public Builder alertRuleRepository(AlertRuleRepository ruleRepository) {
            this.ruleRepository = ruleRepository;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LeadDiscoveryEngine build() {
            if (options == null) {
                throw new IllegalStateException("EngineOptions is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new LeadDiscoveryEngine(this);
        }
    }
}
