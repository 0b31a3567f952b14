package com.lead.discovery.matching;

import com.lead.discovery.alert.AlertDispatcher;
import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.catalog.ServiceCatalog;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.Match;
import com.lead.discovery.core.model.MatchStatus;
import com.lead.discovery.core.model.ServiceOffering;
import com.lead.discovery.lead.LeadRepository;
import com.lead.discovery.logging.LogContext;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.tracing.Span;
import com.lead.discovery.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pairs leads with service offerings and keeps the resulting matches.
 *
 * <p>Scoring fails soft: a pair that cannot be scored is logged and left out, the rest of
 * the run continues. Re-running a match overwrites scores and reasons but keeps the
 * follow-up status and notes set on the stored match.</p>
 */
public class Matchmaker {
    private static final Logger log = LoggerFactory.getLogger(Matchmaker.class);

    public static final double DEFAULT_ALERT_THRESHOLD = 75.0;

    private static final Comparator<Match> BY_SCORE =
            Comparator.comparingDouble(Match::getMatchScore).reversed().thenComparing(Match::getServiceId);

    private final LeadRepository leadRepository;
    private final ServiceCatalog serviceCatalog;
    private final MatchRepository matchRepository;
    private final MatchingAlgorithm algorithm;
    private final AlertDispatcher alertDispatcher;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final double alertThreshold;
    private final Clock clock;

    public Matchmaker(LeadRepository leadRepository, ServiceCatalog serviceCatalog, MatchRepository matchRepository,
                      MatchingAlgorithm algorithm, AlertDispatcher alertDispatcher, AuditService auditService,
                      MetricsService metricsService, TracingService tracingService, double alertThreshold,
                      Clock clock) {
        this.leadRepository = leadRepository;
        this.serviceCatalog = serviceCatalog;
        this.matchRepository = matchRepository;
        this.algorithm = algorithm;
        this.alertDispatcher = alertDispatcher;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.alertThreshold = alertThreshold;
        this.clock = clock;
    }

    public MatchBreakdown calculateMatchScore(Lead lead, ServiceOffering service) {
        return algorithm.calculate(lead, service);
    }

    public MatchBreakdown calculateMatchScore(Lead lead, ServiceOffering service, MatchingWeights weights) {
        return algorithm.calculate(lead, service, weights);
    }

    /**
     * Scores the lead against every active service and stores the best {@code limit}
     * matches with a positive score.
     *
     * @return the stored matches, best first
     * @throws NotFoundException if the lead does not exist
     */
    public List<Match> matchLeadToServices(String leadId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new NotFoundException("Lead", leadId));
        Instant start = Instant.now();

        try (LogContext ignored = LogContext.forMatching(LogContext.generateCorrelationId(), leadId);
             Span span = tracingService.startSpan("match", Map.of("leadId", leadId))) {
            List<ServiceOffering> services = serviceCatalog.findActive();
            Map<String, ServiceOffering> servicesById = new HashMap<>();
            List<Match> candidates = new ArrayList<>();
            int failed = 0;
            for (ServiceOffering service : services) {
                try {
                    MatchBreakdown breakdown = algorithm.calculate(lead, service);
                    if (breakdown.matchScore() > 0) {
                        candidates.add(breakdown.toMatch(leadId, service.getId(), clock.instant()));
                        servicesById.put(service.getId(), service);
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("match.pair.failed leadId={} serviceId={} error={}", leadId, service.getId(), e.getMessage());
                }
            }
            candidates.sort(BY_SCORE);

            List<Match> stored = new ArrayList<>();
            for (Match candidate : candidates.subList(0, Math.min(limit, candidates.size()))) {
                Match match = matchRepository.upsert(candidate);
                metricsService.recordMatchScore(match.getMatchScore());
                stored.add(match);
                if (match.getMatchScore() >= alertThreshold) {
                    raiseMatchAlert(lead, match, servicesById.get(match.getServiceId()));
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            metricsService.recordMatchingDuration(duration);
            span.setAttribute("services", services.size());
            span.setAttribute("matches", stored.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("match.completed leadId={} services={} stored={} failedPairs={} durationMs={}",
                    leadId, services.size(), stored.size(), failed, duration.toMillis());
            return stored;
        }
    }

    /**
     * Stored matches of the lead when there are any, else a fresh matching run.
     */
    public List<Match> recommendServices(String leadId, int limit) {
        List<Match> existing = matchRepository.findByLead(leadId);
        if (!existing.isEmpty()) {
            return existing.subList(0, Math.min(limit, existing.size()));
        }
        return matchLeadToServices(leadId, limit);
    }

    public List<Match> getLeadMatches(String leadId) {
        return matchRepository.findByLead(leadId);
    }

    /**
     * Ranks eligible leads for one service by stored score (unscored last), then intent,
     * then signal strength. Leads without a stored match are scored and stored on the way.
     *
     * @throws NotFoundException if the service does not exist
     */
    public List<RankedLead> rankLeads(String serviceId, LeadFilter filter, int limit) {
        ServiceOffering service = serviceCatalog.findById(serviceId)
                .orElseThrow(() -> new NotFoundException("Service", serviceId));
        LeadFilter criteria = filter != null ? filter : LeadFilter.none();

        try (LogContext ignored = LogContext.forRanking(LogContext.generateCorrelationId(), serviceId)) {
            Map<String, Match> stored = new HashMap<>();
            matchRepository.findByService(serviceId).forEach(m -> stored.put(m.getLeadId(), m));

            List<Lead> candidates = leadRepository.findActive().stream()
                    .filter(criteria::test)
                    .filter(l -> criteria.acceptsScore(scoreOf(stored.get(l.getId()))))
                    .sorted(Comparator
                            .comparing((Lead l) -> scoreOf(stored.get(l.getId())),
                                    Comparator.nullsLast(Comparator.reverseOrder()))
                            .thenComparing(Lead::getIntentScore, Comparator.reverseOrder())
                            .thenComparing(Lead::getSignalStrength, Comparator.reverseOrder()))
                    .limit(limit)
                    .toList();

            List<RankedLead> ranked = new ArrayList<>();
            for (Lead lead : candidates) {
                Match existing = stored.get(lead.getId());
                if (existing != null) {
                    ranked.add(new RankedLead(lead, existing.getMatchScore(), existing.getStatus(),
                            existing.getReasons(), false));
                    continue;
                }
                try {
                    Match computed = algorithm.calculate(lead, service)
                            .toMatch(lead.getId(), serviceId, clock.instant());
                    Match match = matchRepository.upsert(computed);
                    metricsService.recordMatchScore(match.getMatchScore());
                    ranked.add(new RankedLead(lead, match.getMatchScore(), match.getStatus(), match.getReasons(), true));
                } catch (RuntimeException e) {
                    log.warn("rank.pair.failed leadId={} serviceId={} error={}", lead.getId(), serviceId, e.getMessage());
                }
            }
            ranked.sort(Comparator.comparingDouble(RankedLead::matchScore).reversed());
            log.info("rank.completed serviceId={} leads={} scored={}", serviceId, ranked.size(),
                    ranked.stream().filter(RankedLead::freshlyScored).count());
            return ranked;
        }
    }

    /**
     * Leads resembling the given one: industry 30, city 20, state 10, shared need 25,
     * company size 15. Zero-similarity and terminal leads are left out.
     */
    public List<SimilarLead> findSimilarLeads(String leadId, int limit) {
        Lead reference = leadRepository.findById(leadId)
                .orElseThrow(() -> new NotFoundException("Lead", leadId));
        return leadRepository.findActive().stream()
                .filter(l -> !l.getId().equals(leadId))
                .map(l -> new SimilarLead(l, similarity(reference, l)))
                .filter(s -> s.similarity() > 0)
                .sorted(Comparator.comparingInt(SimilarLead::similarity).reversed()
                        .thenComparing((SimilarLead s) -> s.lead().getSignalStrength(), Comparator.reverseOrder()))
                .limit(limit)
                .toList();
    }

    /**
     * Sets the follow-up status of a match and records it in the match history.
     * Null notes keep the existing notes.
     */
    public Match updateMatchStatus(String matchId, MatchStatus status, String notes) {
        Match match = matchRepository.findById(matchId)
                .orElseThrow(() -> new NotFoundException("Match", matchId));
        MatchStatus previous = match.getStatus();
        match.updateStatus(status, notes, clock.instant());
        matchRepository.save(match);
        auditService.record(AuditAction.MATCH_STATUS_CHANGED, matchId,
                Map.of("from", previous.name(), "to", status.name(), "event", "status_changed_" + status.code()));
        log.info("match.status_changed id={} from={} to={}", matchId, previous, status);
        return match;
    }

    public MatchAnalytics matchAnalytics(String serviceId) {
        List<Match> matches = serviceId != null ? matchRepository.findByService(serviceId) : matchRepository.findAll();
        return new MatchAnalytics(
                serviceId,
                matches.size(),
                matches.stream().mapToDouble(Match::getMatchScore).average().orElse(0.0),
                countStatus(matches, MatchStatus.CONTACTED),
                countStatus(matches, MatchStatus.INTERESTED),
                countStatus(matches, MatchStatus.CONVERTED),
                matches.stream().filter(m -> m.getMatchScore() >= 80).count(),
                matches.stream().filter(m -> m.getMatchScore() >= 60 && m.getMatchScore() < 80).count(),
                matches.stream().filter(m -> m.getMatchScore() < 60).count());
    }

    private void raiseMatchAlert(Lead lead, Match match, ServiceOffering service) {
        if (alertDispatcher == null || service == null) {
            return;
        }
        try {
            alertDispatcher.emitMatchFound(lead, match, service);
        } catch (RuntimeException e) {
            log.warn("match.alert.failed leadId={} serviceId={} error={}", lead.getId(), service.getId(), e.getMessage());
        }
    }

    static int similarity(Lead reference, Lead other) {
        int score = 0;
        if (reference.getIndustry() != null && reference.getIndustry().equalsIgnoreCase(other.getIndustry())) {
            score += 30;
        }
        if (reference.getCity() != null && reference.getCity().equalsIgnoreCase(other.getCity())) {
            score += 20;
        }
        if (reference.getState() != null && reference.getState().equalsIgnoreCase(other.getState())) {
            score += 10;
        }
        Set<String> shared = new HashSet<>(reference.getNeedsIdentified());
        shared.retainAll(other.getNeedsIdentified());
        if (!shared.isEmpty()) {
            score += 25;
        }
        if (reference.getCompanySize() != null && reference.getCompanySize().equalsIgnoreCase(other.getCompanySize())) {
            score += 15;
        }
        return score;
    }

    private static Double scoreOf(Match match) {
        return match != null ? match.getMatchScore() : null;
    }

    private static long countStatus(List<Match> matches, MatchStatus status) {
        return matches.stream().filter(m -> Objects.equals(m.getStatus(), status)).count();
    }
}
