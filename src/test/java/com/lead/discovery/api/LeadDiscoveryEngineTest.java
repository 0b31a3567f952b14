package com.lead.discovery.api;

import com.lead.discovery.alert.AlertFilter;
import com.lead.discovery.catalog.CachingServiceCatalog;
import com.lead.discovery.catalog.InMemoryServiceCatalog;
import com.lead.discovery.core.model.Alert;
import com.lead.discovery.core.model.AlertType;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.Match;
import com.lead.discovery.core.model.ServiceOffering;
import com.lead.discovery.graph.StubGraphConnection;
import com.lead.discovery.lead.BusinessListing;
import com.lead.discovery.lead.DiscoveryCriteria;
import com.lead.discovery.lead.DiscoveryResult;
import com.lead.discovery.lead.InMemoryBusinessDirectory;
import com.lead.discovery.privacy.PrivacyMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LeadDiscoveryEngineTest {

    private LeadDiscoveryEngine engine;

    @BeforeEach
    void setUp() {
        InMemoryServiceCatalog catalog = new InMemoryServiceCatalog(List.of(ServiceOffering.builder()
                .id("svc-loan")
                .serviceName("Small Business Loans")
                .serviceType("business_loan")
                .targetIndustries(List.of("technology", "saas"))
                .targetLocations(List.of("nationwide"))
                .build()));
        InMemoryBusinessDirectory directory = new InMemoryBusinessDirectory("local", List.of(
                BusinessListing.builder().businessName("Austin Tech").industry("technology")
                        .city("Austin").state("TX").source("local").build(),
                BusinessListing.builder().businessName("Dallas Bakery").industry("food")
                        .city("Dallas").state("TX").source("local").build()));

        engine = LeadDiscoveryEngine.builder()
                .serviceCatalog(catalog)
                .directory(directory)
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Discovered and observed leads flow through matching into alerts")
    void endToEnd() {
        DiscoveryResult discovered = engine.discoverLeads(DiscoveryCriteria.builder()
                .geographicArea("Austin, TX")
                .build());
        assertEquals(1, discovered.leadCount());
        assertEquals("Austin Tech", engine.getLead(discovered.leadIds().get(0)).getName());

        Lead observed = engine.leads().build(Lead.builder()
                        .name("Jane")
                        .industry("technology")
                        .city("Austin")
                        .state("TX"),
                "We need a business loan urgently, about $50,000.", null);
        assertEquals(Set.of("business_loan"), observed.getNeedsIdentified());

        List<Match> matches = engine.matchLeadToServices(observed.getId());

        assertEquals(1, matches.size());
        assertTrue(matches.get(0).getMatchScore() >= engine.getOptions().getAlertThreshold());
        List<Alert> alerts = engine.getAlerts(AlertFilter.builder().alertType(AlertType.HIGH_SCORE_MATCH).build());
        assertEquals(1, alerts.size());
        assertEquals(observed.getId(), alerts.get(0).getLeadId());
        assertInstanceOf(CachingServiceCatalog.class, engine.serviceCatalog());
    }

    @Test
    @DisplayName("Identifiers seen together resolve to one profile, reconciled duplicates merge")
    void identityResolution() {
        String email = engine.identifiers().trackIdentifier(IdentifierType.EMAIL, "jane@example.com");
        String cookie = engine.identifiers().trackIdentifier(IdentifierType.COOKIE, "visitor-1");

        String profileId = engine.profiles().buildProfile(List.of(email, cookie));

        assertEquals(profileId, engine.profiles().buildProfile(List.of(cookie, email)));
        assertEquals(profileId, engine.profiles()
                .getProfileByIdentifier(IdentifierType.EMAIL, "jane@example.com").orElseThrow().getId());
        assertTrue(engine.reconcileDuplicateProfiles().isEmpty());
    }

    @Test
    void privacyModeAppliesToTheNextCall() {
        assertTrue(engine.profiles().fingerprintDevice(Map.of("userAgent", "Firefox"), null).isEmpty());

        engine.setPrivacyMode(PrivacyMode.PERMISSIVE);

        assertEquals(PrivacyMode.PERMISSIVE, engine.getPrivacyPolicy().mode());
        assertTrue(engine.profiles().fingerprintDevice(Map.of("userAgent", "Firefox"), null).isPresent());
        assertThrows(IllegalArgumentException.class, () -> engine.setPrivacyPolicy(null));
    }

    @Test
    void retentionRunsAgainstTheConfiguredPolicy() {
        assertEquals(90, engine.applyRetention().identifierRetentionDays());
    }

    @Test
    @DisplayName("A supplied graph connection is indexed but left open")
    void graphConnectionIsBorrowed() {
        StubGraphConnection connection = new StubGraphConnection();

        LeadDiscoveryEngine graphEngine = LeadDiscoveryEngine.builder()
                .graphConnection(connection)
                .options(EngineOptions.builder().topN(3).build())
                .build();
        graphEngine.close();

        assertTrue(connection.indexesCreated);
        assertFalse(connection.closed);
        assertEquals(3, graphEngine.getOptions().getTopN());
    }

    @Test
    void invalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> EngineOptions.builder().topN(0).build());
        assertThrows(IllegalArgumentException.class, () -> EngineOptions.builder().maxConcurrency(0).build());
    }
}
