package com.lead.discovery.retention;

import com.lead.discovery.MutableClock;
import com.lead.discovery.alert.AlertDispatcher;
import com.lead.discovery.alert.AlertRepository;
import com.lead.discovery.alert.InMemoryAlertRepository;
import com.lead.discovery.alert.InMemoryAlertRuleRepository;
import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditEntry;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.model.Alert;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.identity.IdentifierStore;
import com.lead.discovery.identity.InMemoryIdentifierRepository;
import com.lead.discovery.lead.InMemoryLeadRepository;
import com.lead.discovery.metrics.NoOpMetricsService;
import com.lead.discovery.privacy.PrivacyMode;
import com.lead.discovery.privacy.PrivacyPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

    private MutableClock storeClock;
    private MutableClock retentionClock;
    private IdentifierStore identifierStore;
    private InMemoryAlertRepository alertRepository;
    private AuditService auditService;
    private PrivacyPolicy privacy;

    @BeforeEach
    void setUp() {
        storeClock = MutableClock.at("2026-01-01T00:00:00Z");
        retentionClock = MutableClock.at("2030-01-01T00:00:00Z");
        privacy = PrivacyPolicy.defaults();
        auditService = new AuditService();
        alertRepository = new InMemoryAlertRepository();
        identifierStore = new IdentifierStore(new InMemoryIdentifierRepository(), () -> privacy,
                auditService, new NoOpMetricsService(), storeClock);
    }

    private RetentionService service(AlertRepository alerts) {
        return new RetentionService(identifierStore, alerts, auditService, () -> privacy, retentionClock);
    }

    @Test
    @DisplayName("Every sweep runs and the run is audited")
    void sweeps() {
        identifierStore.trackIdentifier(IdentifierType.COOKIE, "stale-visitor");
        storeClock.advance(Duration.ofDays(100));
        identifierStore.trackIdentifier(IdentifierType.COOKIE, "fresh-visitor");

        MutableClock alertClock = MutableClock.at("2026-01-01T00:00:00Z");
        AlertDispatcher dispatcher = new AlertDispatcher(alertRepository, new InMemoryAlertRuleRepository(),
                new InMemoryLeadRepository(), auditService, new NoOpMetricsService(), alertClock);
        Alert dismissed = dispatcher.emitGeographic("lead-1", "Austin, TX");
        dispatcher.dismiss(dismissed.getId());
        dispatcher.emitGeographic("lead-2", "Dallas, TX");

        RetentionResult result = service(alertRepository).applyRetention(RetentionPolicy.builder()
                .alertRetention(Duration.ofDays(90))
                .auditRetention(Duration.ofDays(1))
                .identifiersEnabled(true)
                .build());

        assertEquals(90, result.identifierRetentionDays());
        assertEquals(1, result.identifiersDeleted());
        assertEquals(1, result.alertsDeleted());
        assertTrue(result.auditEntriesDeleted() > 0);
        assertEquals(result.identifiersDeleted() + result.alertsDeleted() + result.auditEntriesDeleted(),
                result.totalDeleted());
        assertEquals(1, alertRepository.count());

        List<AuditEntry> entries = auditService.getEntriesByAction(AuditAction.RETENTION_APPLIED);
        assertEquals(1, entries.size());
        assertEquals("RETENTION", entries.get(0).subjectId());
        assertEquals("RETENTION_SERVICE", entries.get(0).actorId());
    }

    @Test
    void identifierSweepCanBeDisabled() {
        identifierStore.trackIdentifier(IdentifierType.COOKIE, "stale-visitor");
        storeClock.advance(Duration.ofDays(400));

        RetentionResult result = service(alertRepository).applyRetention(RetentionPolicy.noExpiration());

        assertEquals(0, result.identifiersDeleted());
        assertEquals(1, identifierStore.getIdentifierStats().totalIdentifiers());
    }

    @Test
    @DisplayName("A failing alert sweep counts as zero and the audit sweep still runs")
    void failingSweepIsContained(@Mock AlertRepository brokenAlerts) {
        when(brokenAlerts.deleteResolvedBefore(any())).thenThrow(new IllegalStateException("store down"));
        auditService.record(AuditAction.PROFILE_CREATED, "p-1", java.util.Map.of());

        RetentionResult result = service(brokenAlerts).applyRetention(RetentionPolicy.builder()
                .alertRetention(Duration.ofDays(1))
                .auditRetention(Duration.ofDays(1))
                .identifiersEnabled(false)
                .build());

        assertEquals(0, result.alertsDeleted());
        assertEquals(1, result.auditEntriesDeleted());
    }

    @Test
    void identifierRetentionFollowsCookieRetention() {
        assertEquals(30, RetentionService.identifierRetentionDays(PrivacyPolicy.of(PrivacyMode.STRICT)));
        assertEquals(90, RetentionService.identifierRetentionDays(PrivacyPolicy.of(PrivacyMode.STANDARD)));
        assertEquals(365, RetentionService.identifierRetentionDays(PrivacyPolicy.of(PrivacyMode.PERMISSIVE)));
    }

    @Test
    void negativeDurationsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetentionPolicy(Duration.ofDays(-1), Duration.ofDays(1), true));
    }
}
