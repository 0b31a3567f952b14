package com.lead.discovery.alert;

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
import com.lead.discovery.lead.LeadRepository;
import com.lead.discovery.logging.LogContext;
import com.lead.discovery.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Persists alerts and routes them through the active rules of their type.
 *
 * <p>An alert is stored before any rule runs, so a failing rule or notifier never loses
 * it. Rule and channel failures are logged and skipped.</p>
 */
public class AlertDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    public static final Duration DEFAULT_SUMMARY_WINDOW = Duration.ofDays(7);

    private final AlertRepository alertRepository;
    private final AlertRuleRepository ruleRepository;
    private final LeadRepository leadRepository;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final List<AlertNotifier> notifiers = new CopyOnWriteArrayList<>();

    public AlertDispatcher(AlertRepository alertRepository, AlertRuleRepository ruleRepository,
                           LeadRepository leadRepository, AuditService auditService,
                           MetricsService metricsService, Clock clock) {
        this.alertRepository = alertRepository;
        this.ruleRepository = ruleRepository;
        this.leadRepository = leadRepository;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public void addNotifier(AlertNotifier notifier) {
        notifiers.add(Objects.requireNonNull(notifier, "notifier"));
    }

    public AlertRule createRule(AlertRule rule) {
        Objects.requireNonNull(rule.getRuleType(), "ruleType is required");
        AlertRule saved = ruleRepository.save(rule);
        auditService.record(AuditAction.ALERT_RULE_CREATED, saved.getId(), Map.of(
                "ruleType", saved.getRuleType().code(),
                "conditions", saved.getConditions().size()));
        log.info("alert.rule.created id={} type={} channels={}", saved.getId(), saved.getRuleType(), saved.getChannels());
        return saved;
    }

    public List<String> setupRules(List<AlertRule> rules) {
        return rules.stream().map(r -> createRule(r).getId()).toList();
    }

    /**
     * Persists a NEW alert, then evaluates every active rule of the alert's type against
     * its data. Matching rules are linked to the alert and fanned out to their channels.
     */
    public Alert emit(String leadId, AlertType type, String title, String message,
                      Priority priority, Map<String, Object> data) {
        Alert alert = Alert.builder()
                .leadId(leadId)
                .alertType(type)
                .title(title)
                .message(message)
                .priority(priority)
                .data(data)
                .status(AlertStatus.NEW)
                .createdAt(clock.instant())
                .build();

        try (LogContext ignored = LogContext.forAlert(type.code(), leadId)) {
            alertRepository.save(alert);
            metricsService.incrementAlertEmitted(type, alert.getPriority());
            log.info("alert.emitted id={} type={} priority={}", alert.getId(), type, alert.getPriority());

            boolean linked = false;
            for (AlertRule rule : ruleRepository.findActiveByType(type)) {
                try {
                    if (rule.matches(alert.getData())) {
                        alert.linkRule(rule.getId());
                        linked = true;
                        log.debug("alert.rule.matched alertId={} ruleId={}", alert.getId(), rule.getId());
                        deliver(rule, alert);
                    }
                } catch (RuntimeException e) {
                    log.warn("alert.rule.failed alertId={} ruleId={} error={}", alert.getId(), rule.getId(), e.getMessage());
                }
            }
            if (linked) {
                alertRepository.save(alert);
            }
        }
        return alert;
    }

    /**
     * Alert for a high-scoring match. Priority is URGENT from 90, HIGH from 75, else MEDIUM.
     */
    public Alert emitMatchFound(Lead lead, Match match, ServiceOffering service) {
        double score = match.getMatchScore();
        String title = String.format(Locale.ROOT, "High Score Match: %.0f%%", score);
        String message = String.format(Locale.ROOT, "Lead '%s' matched with service '%s' at %.0f%% confidence",
                lead.displayName(), service.getServiceName(), score);
        Priority priority = score >= 90 ? Priority.URGENT : score >= 75 ? Priority.HIGH : Priority.MEDIUM;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("match_id", match.getId());
        data.put("service_id", service.getId());
        data.put("match_score", score);
        return emit(lead.getId(), AlertType.HIGH_SCORE_MATCH, title, message, priority, data);
    }

    public Alert emitGeographic(String leadId, String location) {
        return emit(leadId, AlertType.GEOGRAPHIC,
                "New Lead in " + location,
                "New lead discovered in targeted area: " + location,
                Priority.MEDIUM, Map.of("location", location));
    }

    public Alert emitIndustry(String leadId, String industry) {
        return emit(leadId, AlertType.INDUSTRY,
                "New Lead in " + industry,
                "New lead discovered in targeted industry: " + industry,
                Priority.MEDIUM, Map.of("industry", industry));
    }

    /**
     * Behavior alert for the lead attached to a profile. Without such a lead nothing is emitted.
     */
    public Optional<Alert> emitBehaviorChange(String profileId, String behaviorType, Map<String, Object> behaviorData) {
        List<Lead> leads = leadRepository.findByProfileId(profileId);
        if (leads.isEmpty()) {
            log.debug("alert.behavior.skipped profileId={} reason=no_lead", profileId);
            return Optional.empty();
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("behavior_type", behaviorType);
        if (behaviorData != null) {
            data.putAll(behaviorData);
        }
        return Optional.of(emit(leads.get(0).getId(), AlertType.BEHAVIOR_CHANGE,
                "Behavior Alert: " + behaviorType,
                "Significant behavior detected: " + behaviorType,
                Priority.MEDIUM, data));
    }

    public Alert markRead(String alertId) {
        return transition(alertId, AlertStatus.READ);
    }

    public Alert markActioned(String alertId) {
        return transition(alertId, AlertStatus.ACTIONED);
    }

    public Alert dismiss(String alertId) {
        return transition(alertId, AlertStatus.DISMISSED);
    }

    public Alert getAlert(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert", alertId));
    }

    public List<Alert> getAlerts(AlertFilter filter) {
        return alertRepository.find(filter);
    }

    public AlertSummary summary() {
        return summary(DEFAULT_SUMMARY_WINDOW);
    }

    public AlertSummary summary(Duration window) {
        Instant since = clock.instant().minus(window);
        List<Alert> alerts = alertRepository.findCreatedSince(since);
        Map<AlertType, Long> counts = new EnumMap<>(AlertType.class);
        alerts.forEach(a -> counts.merge(a.getAlertType(), 1L, Long::sum));
        Map<AlertType, Long> byType = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<AlertType, Long>comparingByValue().reversed())
                .forEach(e -> byType.put(e.getKey(), e.getValue()));
        return new AlertSummary(
                since,
                alerts.size(),
                countStatus(alerts, AlertStatus.NEW),
                countStatus(alerts, AlertStatus.READ),
                countStatus(alerts, AlertStatus.ACTIONED),
                countStatus(alerts, AlertStatus.DISMISSED),
                alerts.stream().filter(a -> a.getPriority() == Priority.URGENT).count(),
                alerts.stream().filter(a -> a.getPriority() == Priority.HIGH).count(),
                byType);
    }

    private Alert transition(String alertId, AlertStatus next) {
        Alert alert = getAlert(alertId);
        AlertStatus previous = alert.getStatus();
        if (previous == next) {
            return alert;
        }
        if (!previous.canTransitionTo(next)) {
            throw new ConflictException("Alert " + alertId + " cannot move from " + previous + " to " + next);
        }
        alert.transitionTo(next, clock.instant());
        alertRepository.save(alert);
        auditService.record(AuditAction.ALERT_STATUS_CHANGED, alertId,
                Map.of("from", previous.name(), "to", next.name()));
        log.info("alert.status_changed id={} from={} to={}", alertId, previous, next);
        return alert;
    }

    private void deliver(AlertRule rule, Alert alert) {
        for (AlertChannel channel : rule.getChannels()) {
            if (!channel.isExternal()) {
                continue;
            }
            List<AlertNotifier> handlers = new ArrayList<>();
            for (AlertNotifier notifier : notifiers) {
                if (notifier.channel() == channel) {
                    handlers.add(notifier);
                }
            }
            if (handlers.isEmpty()) {
                log.debug("alert.channel.skipped alertId={} channel={} reason=no_notifier", alert.getId(), channel);
                continue;
            }
            for (AlertNotifier notifier : handlers) {
                try {
                    notifier.send(rule, alert);
                } catch (RuntimeException e) {
                    log.warn("alert.channel.failed alertId={} channel={} error={}", alert.getId(), channel, e.getMessage());
                }
            }
        }
    }

    private static long countStatus(List<Alert> alerts, AlertStatus status) {
        return alerts.stream().filter(a -> a.getStatus() == status).count();
    }
}
