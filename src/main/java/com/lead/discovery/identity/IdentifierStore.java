package com.lead.discovery.identity;

import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Identifier;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.privacy.PrivacyPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Records raw observed identifiers as hashed, deduplicated {@link Identifier}s.
 *
 * <p>Identity is (type, SHA-256 of the raw value). A repeat observation bumps the
 * seen count, refreshes lastSeen and unions the site, so tracking is idempotent.
 * The same value under two types yields two identifiers.</p>
 */
public class IdentifierStore {
    private static final Logger log = LoggerFactory.getLogger(IdentifierStore.class);

    private final IdentifierRepository repository;
    private final IdentifierExtractor extractor;
    private final Supplier<PrivacyPolicy> privacyPolicy;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;

    public IdentifierStore(IdentifierRepository repository, Supplier<PrivacyPolicy> privacyPolicy,
                           AuditService auditService, MetricsService metricsService, Clock clock) {
        this.repository = repository;
        this.extractor = new IdentifierExtractor();
        this.privacyPolicy = privacyPolicy;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public String trackIdentifier(IdentifierType type, String rawValue) {
        return trackIdentifier(type, rawValue, null, Map.of());
    }

    /**
     * Tracks one observation and returns the identifier id.
     *
     * @throws ValidationException if the type is null or the value blank
     */
    public String trackIdentifier(IdentifierType type, String rawValue, String site, Map<String, String> metadata) {
        return observe(type, rawValue, site, metadata).identifier().getId();
    }

    public ObservationResult observe(IdentifierType type, String rawValue, String site, Map<String, String> metadata) {
        if (type == null) {
            throw new ValidationException("Identifier type is required");
        }
        if (rawValue == null || rawValue.isBlank()) {
            throw new ValidationException("Identifier value must not be blank");
        }
        String value = rawValue.trim();
        boolean crossSite = privacyPolicy.get().allowsCrossSiteTracking();
        ObservationResult result = repository.recordObservation(type, IdentifierHasher.hash(value), value,
                site, metadata != null ? metadata : Map.of(), clock.instant(), crossSite);
        metricsService.incrementIdentifierTracked(type, result.created());
        if (result.created()) {
            log.debug("identifier.created id={} type={}", result.identifier().getId(), type);
        } else {
            log.trace("identifier.seen id={} type={} count={}",
                    result.identifier().getId(), type, result.identifier().getSeenCount());
        }
        return result;
    }

    /**
     * Tracks each cookie as {@code name=value} seen on {@code siteUrl}. A cookie that fails
     * is logged and skipped.
     */
    public List<String> trackCookies(String siteUrl, Map<String, String> cookies) {
        List<String> ids = new ArrayList<>();
        cookies.forEach((name, value) -> {
            try {
                ids.add(trackIdentifier(IdentifierType.COOKIE, name + "=" + value, siteUrl,
                        Map.of("cookieName", name)));
            } catch (RuntimeException e) {
                log.warn("identifier.cookie.failed site={} cookie={} error={}", siteUrl, name, e.getMessage());
            }
        });
        return ids;
    }

    /**
     * Runs every extraction library over the content and tracks each distinct match once.
     *
     * @return the tracked identifiers, in extraction order
     */
    public List<Identifier> extractAndTrack(ObservedContent content) {
        List<Identifier> tracked = new ArrayList<>();
        for (ExtractedIdentifier extracted : extractor.extract(content)) {
            try {
                tracked.add(observe(extracted.type(), extracted.value(), content.siteUrl(),
                        Map.of("source", extracted.source())).identifier());
            } catch (RuntimeException e) {
                log.warn("identifier.extract.failed type={} source={} error={}",
                        extracted.type(), extracted.source(), e.getMessage());
            }
        }
        log.debug("identifier.extracted site={} count={}", content.siteUrl(), tracked.size());
        return tracked;
    }

    public List<ExtractedIdentifier> extract(ObservedContent content) {
        return extractor.extract(content);
    }

    public Optional<Identifier> getIdentifier(IdentifierType type, String rawValue) {
        if (type == null || rawValue == null || rawValue.isBlank()) {
            return Optional.empty();
        }
        return repository.findByTypeAndHash(type, IdentifierHasher.hash(rawValue.trim()));
    }

    public Identifier getById(String identifierId) {
        return repository.findById(identifierId)
                .orElseThrow(() -> new NotFoundException("Identifier", identifierId));
    }

    /**
     * Identifiers owned by the profile, most recently seen first.
     */
    public List<Identifier> getProfileIdentifiers(String profileId) {
        return repository.findByProfileId(profileId);
    }

    /**
     * Replaces the raw value with a sentinel. The hash stays, so correlation continues.
     */
    public Identifier anonymizeIdentifier(String identifierId) {
        Identifier identifier = getById(identifierId);
        if (identifier.isAnonymized()) {
            return identifier;
        }
        Identifier anonymized = repository.anonymize(identifierId)
                .orElseThrow(() -> new NotFoundException("Identifier", identifierId));
        auditService.record(AuditAction.IDENTIFIER_ANONYMIZED, identifierId,
                Map.of("type", anonymized.getType().code()));
        log.info("identifier.anonymized id={} type={}", identifierId, anonymized.getType());
        return anonymized;
    }

    /**
     * Hard delete. Any profile correlation through this identifier is lost.
     */
    public void deleteIdentifier(String identifierId) {
        Identifier identifier = getById(identifierId);
        repository.delete(identifierId);
        Map<String, Object> details = identifier.getProfileId() != null
                ? Map.of("type", identifier.getType().code(), "profileId", identifier.getProfileId())
                : Map.of("type", identifier.getType().code());
        auditService.record(AuditAction.IDENTIFIER_DELETED, identifierId, details);
        log.info("identifier.deleted id={} type={}", identifierId, identifier.getType());
    }

    /**
     * Deletes unlinked identifiers not seen within the retention window. Linked identifiers
     * are kept regardless of age.
     *
     * @return number of identifiers removed, 0 when the sweep failed
     */
    public long cleanupOldIdentifiers(int retentionDays) {
        if (retentionDays < 0) {
            throw new ValidationException("retentionDays must not be negative: " + retentionDays);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        try {
            long removed = repository.deleteUnlinkedLastSeenBefore(cutoff);
            log.info("identifier.cleanup retentionDays={} removed={}", retentionDays, removed);
            return removed;
        } catch (RuntimeException e) {
            log.warn("identifier.cleanup.failed retentionDays={} error={}", retentionDays, e.getMessage());
            return 0;
        }
    }

    public IdentifierStats getIdentifierStats() {
        return repository.stats();
    }
}
