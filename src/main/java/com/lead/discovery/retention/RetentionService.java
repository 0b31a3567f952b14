package com.lead.discovery.retention;

import com.lead.discovery.alert.AlertRepository;
import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.identity.IdentifierStore;
import com.lead.discovery.privacy.DataCategory;
import com.lead.discovery.privacy.PrivacyPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Applies data retention: unlinked identifiers past the privacy-mode cutoff,
 * resolved alerts and old audit entries.
 *
 * <p>Sweeps are best-effort. A failing sweep is logged and counts as zero deletions;
 * the remaining sweeps still run.</p>
 */
public class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final IdentifierStore identifierStore;
    private final AlertRepository alertRepository;
    private final AuditService auditService;
    private final Supplier<PrivacyPolicy> privacyPolicy;
    private final Clock clock;

    public RetentionService(IdentifierStore identifierStore, AlertRepository alertRepository,
                            AuditService auditService, Supplier<PrivacyPolicy> privacyPolicy) {
        this(identifierStore, alertRepository, auditService, privacyPolicy, Clock.systemUTC());
    }

    public RetentionService(IdentifierStore identifierStore, AlertRepository alertRepository,
                            AuditService auditService, Supplier<PrivacyPolicy> privacyPolicy, Clock clock) {
        this.identifierStore = identifierStore;
        this.alertRepository = alertRepository;
        this.auditService = auditService;
        this.privacyPolicy = privacyPolicy;
        this.clock = clock;
    }

    /**
     * Runs every sweep the policy enables.
     *
     * @param policy the retention policy to apply
     * @return per-sweep deletion counts
     */
    public RetentionResult applyRetention(RetentionPolicy policy) {
        PrivacyPolicy privacy = privacyPolicy.get();
        int identifierDays = identifierRetentionDays(privacy);
        log.info("retention.starting policy={} privacyMode={} identifierRetentionDays={}",
                policy, privacy.mode(), identifierDays);
        Instant now = clock.instant();

        long identifiersDeleted = policy.identifiersEnabled()
                ? identifierStore.cleanupOldIdentifiers(identifierDays)
                : 0;
        long alertsDeleted = cleanupAlerts(now.minus(policy.alertRetention()));
        long auditDeleted = cleanupAudit(now.minus(policy.auditRetention()));

        RetentionResult result = new RetentionResult(identifierDays, identifiersDeleted, alertsDeleted, auditDeleted);

        auditService.record(AuditAction.RETENTION_APPLIED, "RETENTION", "RETENTION_SERVICE", Map.of(
                "privacyMode", privacy.mode().name(),
                "identifiersDeleted", identifiersDeleted,
                "alertsDeleted", alertsDeleted,
                "auditEntriesDeleted", auditDeleted,
                "totalDeleted", result.totalDeleted()
        ));

        log.info("retention.completed result={}", result);
        return result;
    }

    /**
     * Identifier retention follows cookie retention of the privacy mode:
     * strict 30, standard 90, permissive 365 days.
     */
    public static int identifierRetentionDays(PrivacyPolicy privacy) {
        return privacy.retentionDays(DataCategory.COOKIES);
    }

    private long cleanupAlerts(Instant cutoff) {
        try {
            int deleted = alertRepository.deleteResolvedBefore(cutoff);
            log.debug("retention.alerts cutoff={} deleted={}", cutoff, deleted);
            return deleted;
        } catch (RuntimeException e) {
            log.warn("retention.alerts.failed cutoff={} error={}", cutoff, e.getMessage());
            return 0;
        }
    }

    private long cleanupAudit(Instant cutoff) {
        try {
            long deleted = auditService.purgeBefore(cutoff);
            log.debug("retention.audit cutoff={} deleted={}", cutoff, deleted);
            return deleted;
        } catch (RuntimeException e) {
            log.warn("retention.audit.failed cutoff={} error={}", cutoff, e.getMessage());
            return 0;
        }
    }
}
