package com.lead.discovery.cdi;

import com.lead.discovery.alert.AlertNotifier;
import com.lead.discovery.api.EngineOptions;
import com.lead.discovery.api.LeadDiscoveryEngine;
import com.lead.discovery.catalog.ServiceCatalog;
import com.lead.discovery.lead.BusinessDirectory;
import com.lead.discovery.matching.MatchingWeights;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.privacy.PrivacyMode;
import com.lead.discovery.tracing.TracingService;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class LeadDiscoveryProducerTest {

    @Mock
    private Instance<BusinessDirectory> directories;
    @Mock
    private Instance<ServiceCatalog> serviceCatalog;
    @Mock
    private Instance<AlertNotifier> notifiers;
    @Mock
    private Instance<MetricsService> metricsService;
    @Mock
    private Instance<TracingService> tracingService;

    private LeadDiscoveryProducer producer;

    @BeforeEach
    void setUp() {
        producer = new LeadDiscoveryProducer();
        producer.store = LeadDiscoveryProducer.STORE_MEMORY;
        producer.weightsProfile = "need-focused";
        producer.alertThreshold = 80;
        producer.topN = 3;
        producer.maxConcurrency = 2;
        producer.discoveryTimeoutMs = 5_000;
        producer.defaultCountry = "CA";
        producer.minSharedIdentifiers = 2;
        producer.cacheEnabled = false;
        producer.cacheMaxSize = 1_000;
        producer.cacheTtlSeconds = 60;
        producer.privacyMode = "gdpr";
        producer.requireConsent = true;
        producer.anonymizeData = true;
        producer.alertRetentionDays = 30;
        producer.auditRetentionDays = 365;
        producer.identifierRetentionEnabled = true;
        producer.directories = directories;
        producer.serviceCatalog = serviceCatalog;
        producer.notifiers = notifiers;
        producer.metricsService = metricsService;
        producer.tracingService = tracingService;
    }

    @Test
    void optionsFollowConfiguration() {
        EngineOptions options = producer.engineOptions();

        assertEquals(MatchingWeights.needFocused(), options.getMatchingWeights());
        assertEquals(80, options.getAlertThreshold());
        assertEquals(3, options.getTopN());
        assertEquals("CA", options.getDefaultCountry());
        assertFalse(options.getCatalogCache().enabled());
        assertEquals(PrivacyMode.STRICT, options.getPrivacyPolicy().mode());
        assertEquals(Duration.ofDays(30), options.getRetentionPolicy().alertRetention());
    }

    @Test
    void unknownWeightsFallBackToDefault() {
        assertEquals(MatchingWeights.defaultWeights(), LeadDiscoveryProducer.weights("aggressive"));
        assertEquals(MatchingWeights.defaultWeights(), LeadDiscoveryProducer.weights(null));
    }

    @Test
    void memoryStoreNeedsNoGraph() {
        LeadDiscoveryEngine engine = producer.leadDiscoveryEngine();

        assertNotNull(producer.matchmaker(engine));
        assertNotNull(producer.alertDispatcher(engine));
        assertEquals(PrivacyMode.STRICT, engine.getPrivacyPolicy().mode());
        producer.closeEngine(engine);
    }
}
