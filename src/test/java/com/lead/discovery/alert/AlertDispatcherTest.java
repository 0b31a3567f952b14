package com.lead.discovery.alert;

import com.lead.discovery.MutableClock;
import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.ConflictException;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.model.Alert;
import com.lead.discovery.core.model.AlertChannel;
import com.lead.discovery.core.model.AlertRule;
import com.lead.discovery.core.model.AlertStatus;
import com.lead.discovery.core.model.AlertType;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.Match;
import com.lead.discovery.core.model.Priority;
import com.lead.discovery.core.model.ServiceOffering;
import com.lead.discovery.lead.InMemoryLeadRepository;
import com.lead.discovery.metrics.NoOpMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AlertDispatcherTest {

    private InMemoryAlertRepository alertRepository;
    private InMemoryLeadRepository leadRepository;
    private AuditService auditService;
    private MutableClock clock;
    private AlertDispatcher dispatcher;
    private RecordingNotifier webhook;

    private Lead lead;
    private ServiceOffering service;

    @BeforeEach
    void setUp() {
        alertRepository = new InMemoryAlertRepository();
        leadRepository = new InMemoryLeadRepository();
        auditService = new AuditService();
        clock = MutableClock.at("2026-04-01T08:00:00Z");
        dispatcher = new AlertDispatcher(alertRepository, new InMemoryAlertRuleRepository(), leadRepository,
                auditService, new NoOpMetricsService(), clock);
        webhook = new RecordingNotifier(AlertChannel.WEBHOOK);
        dispatcher.addNotifier(webhook);

        lead = leadRepository.save(Lead.builder().name("Austin Tech").profileId("profile-1").build());
        service = ServiceOffering.builder().id("svc-loan").serviceName("Small Business Loans")
                .serviceType("business_loan").build();
    }

    private Match match(double score) {
        return Match.builder().leadId(lead.getId()).serviceId(service.getId()).matchScore(score).build();
    }

    private AlertRule highScoreRule() {
        return AlertRule.builder()
                .ruleName("top matches")
                .ruleType(AlertType.HIGH_SCORE_MATCH)
                .conditions(Map.of("min_match_score", 90))
                .channels(EnumSet.of(AlertChannel.DASHBOARD, AlertChannel.WEBHOOK))
                .webhookUrl("https://hooks.example/alerts")
                .build();
    }

    @Nested
    @DisplayName("Rule evaluation")
    class RuleEvaluation {

        @Test
        @DisplayName("min_match_score 90 fires for a 96.7 match")
        void ruleFires() {
            AlertRule rule = dispatcher.createRule(highScoreRule());

            Alert alert = dispatcher.emitMatchFound(lead, match(96.7), service);

            assertEquals("High Score Match: 97%", alert.getTitle());
            assertEquals(Priority.URGENT, alert.getPriority());
            assertEquals(96.7, alert.getData().get("match_score"));
            assertEquals("svc-loan", alert.getData().get("service_id"));
            assertEquals(java.util.Set.of(rule.getId()), dispatcher.getAlert(alert.getId()).getRuleIds());
            assertEquals(1, webhook.sent.size());
        }

        @Test
        @DisplayName("min_match_score 90 does not fire for an 85 match, but the alert is kept")
        void ruleDoesNotFire() {
            dispatcher.createRule(highScoreRule());

            Alert alert = dispatcher.emitMatchFound(lead, match(85), service);

            assertEquals(Priority.HIGH, alert.getPriority());
            assertTrue(dispatcher.getAlert(alert.getId()).getRuleIds().isEmpty());
            assertTrue(webhook.sent.isEmpty());
            assertEquals(1, alertRepository.count());
        }

        @Test
        void rulesOfOtherTypesAndInactiveRulesAreIgnored() {
            dispatcher.createRule(AlertRule.builder().ruleName("geo").ruleType(AlertType.GEOGRAPHIC)
                    .channels(EnumSet.of(AlertChannel.WEBHOOK)).build());
            dispatcher.createRule(AlertRule.builder().ruleName("off").ruleType(AlertType.HIGH_SCORE_MATCH)
                    .channels(EnumSet.of(AlertChannel.WEBHOOK)).active(false).build());

            Alert alert = dispatcher.emitMatchFound(lead, match(99), service);

            assertTrue(dispatcher.getAlert(alert.getId()).getRuleIds().isEmpty());
            assertTrue(webhook.sent.isEmpty());
        }

        @Test
        @DisplayName("A failing notifier does not lose the alert or stop other rules")
        void notifierFailureIsContained() {
            dispatcher.addNotifier(new AlertNotifier() {
                @Override
                public AlertChannel channel() {
                    return AlertChannel.WEBHOOK;
                }

                @Override
                public void send(AlertRule rule, Alert alert) {
                    throw new IllegalStateException("endpoint unreachable");
                }
            });
            dispatcher.setupRules(List.of(highScoreRule(), highScoreRule()));

            Alert alert = dispatcher.emitMatchFound(lead, match(95), service);

            assertEquals(2, dispatcher.getAlert(alert.getId()).getRuleIds().size());
            assertEquals(2, webhook.sent.size());
            assertEquals(2, auditService.getEntriesByAction(AuditAction.ALERT_RULE_CREATED).size());
        }

        @Test
        void mediumPriorityBelowSeventyFive() {
            assertEquals(Priority.MEDIUM, dispatcher.emitMatchFound(lead, match(60), service).getPriority());
        }
    }

    @Nested
    @DisplayName("Other alert kinds")
    class OtherKinds {

        @Test
        void geographicAndIndustry() {
            Alert geo = dispatcher.emitGeographic(lead.getId(), "Austin, TX");
            Alert industry = dispatcher.emitIndustry(lead.getId(), "technology");

            assertEquals(AlertType.GEOGRAPHIC, geo.getAlertType());
            assertEquals("New Lead in Austin, TX", geo.getTitle());
            assertEquals("technology", industry.getData().get("industry"));
        }

        @Test
        void behaviorChangeNeedsALead() {
            Optional<Alert> alert = dispatcher.emitBehaviorChange("profile-1", "loan_calculator", Map.of("visits", 3));

            assertTrue(alert.isPresent());
            assertEquals(lead.getId(), alert.get().getLeadId());
            assertEquals("loan_calculator", alert.get().getData().get("behavior_type"));
            assertEquals(3, alert.get().getData().get("visits"));

            assertTrue(dispatcher.emitBehaviorChange("profile-without-lead", "x", null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Status transitions")
    class Transitions {

        @Test
        void newReadActioned() {
            Alert alert = dispatcher.emitGeographic(lead.getId(), "Austin, TX");
            clock.advance(Duration.ofMinutes(1));

            Alert read = dispatcher.markRead(alert.getId());
            assertEquals(AlertStatus.READ, read.getStatus());
            assertEquals(clock.instant(), read.getReadAt());

            Alert actioned = dispatcher.markActioned(alert.getId());
            assertEquals(AlertStatus.ACTIONED, actioned.getStatus());
            assertNotNull(dispatcher.getAlert(alert.getId()).getActionedAt());
            assertEquals(2, auditService.getEntriesByAction(AuditAction.ALERT_STATUS_CHANGED).size());
        }

        @Test
        void illegalMoves_conflict() {
            Alert alert = dispatcher.emitGeographic(lead.getId(), "Austin, TX");
            assertThrows(ConflictException.class, () -> dispatcher.markActioned(alert.getId()));

            dispatcher.dismiss(alert.getId());
            assertThrows(ConflictException.class, () -> dispatcher.markRead(alert.getId()));
        }

        @Test
        void repeatingTheCurrentStatusIsANoOp() {
            Alert alert = dispatcher.emitGeographic(lead.getId(), "Austin, TX");
            dispatcher.markRead(alert.getId());
            dispatcher.markRead(alert.getId());

            assertEquals(1, auditService.getEntriesByAction(AuditAction.ALERT_STATUS_CHANGED).size());
        }

        @Test
        void unknownAlert_notFound() {
            assertThrows(NotFoundException.class, () -> dispatcher.markRead("missing"));
        }
    }

    @Test
    void filterAndSummary() {
        Alert old = dispatcher.emitGeographic(lead.getId(), "Austin, TX");
        clock.advance(Duration.ofDays(10));
        dispatcher.emitMatchFound(lead, match(95), service);
        Alert recent = dispatcher.emitIndustry(lead.getId(), "technology");
        dispatcher.markRead(recent.getId());

        List<Alert> unread = dispatcher.getAlerts(AlertFilter.builder().status(AlertStatus.NEW).build());
        assertEquals(2, unread.size());
        assertEquals(List.of(old.getId()),
                dispatcher.getAlerts(AlertFilter.builder().alertType(AlertType.GEOGRAPHIC).build())
                        .stream().map(Alert::getId).toList());
        assertEquals(1, dispatcher.getAlerts(AlertFilter.builder().limit(1).build()).size());

        AlertSummary summary = dispatcher.summary();
        assertEquals(2, summary.total());
        assertEquals(1, summary.newCount());
        assertEquals(1, summary.readCount());
        assertEquals(1, summary.urgentCount());
        assertFalse(summary.byType().containsKey(AlertType.GEOGRAPHIC));
    }

    private static class RecordingNotifier implements AlertNotifier {
        private final AlertChannel channel;
        private final List<String> sent = new ArrayList<>();

        RecordingNotifier(AlertChannel channel) {
            this.channel = channel;
        }

        @Override
        public AlertChannel channel() {
            return channel;
        }

        @Override
        public void send(AlertRule rule, Alert alert) {
            sent.add(rule.getId() + ":" + alert.getId());
        }
    }
}
