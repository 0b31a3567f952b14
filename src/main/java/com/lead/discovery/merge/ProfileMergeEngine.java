package com.lead.discovery.merge;

import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.ConflictException;
import com.lead.discovery.core.exception.LeadDiscoveryException;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.model.Profile;
import com.lead.discovery.identity.IdentifierRepository;
import com.lead.discovery.identity.ProfileRepository;
import com.lead.discovery.lead.LeadRepository;
import com.lead.discovery.logging.LogContext;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.tracing.Span;
import com.lead.discovery.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges one profile into another as a single compensating transaction.
 *
 * <p>Steps, each undone in reverse order if a later one fails:</p>
 * <ol>
 *   <li>reassign every identifier the source owns at that moment to the target</li>
 *   <li>fold the source's fields into the target and save it</li>
 *   <li>re-point the source's leads at the target</li>
 *   <li>delete the source</li>
 * </ol>
 * The caller's target always survives.
 */
public class ProfileMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(ProfileMergeEngine.class);

    private final ProfileRepository profileRepository;
    private final IdentifierRepository identifierRepository;
    private final LeadRepository leadRepository;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    public ProfileMergeEngine(ProfileRepository profileRepository,
                              IdentifierRepository identifierRepository,
                              LeadRepository leadRepository,
                              AuditService auditService,
                              MetricsService metricsService,
                              TracingService tracingService,
                              Clock clock) {
        this.profileRepository = profileRepository;
        this.identifierRepository = identifierRepository;
        this.leadRepository = leadRepository;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
    }

    /**
     * Merges {@code sourceProfileId} into {@code targetProfileId}.
     *
     * @throws ConflictException     if source and target are the same profile
     * @throws NotFoundException     if either profile does not exist
     * @throws LeadDiscoveryException if a step failed; the merge has then been rolled back
     */
    public MergeResult merge(String sourceProfileId, String targetProfileId, String triggeredBy) {
        if (sourceProfileId.equals(targetProfileId)) {
            throw new ConflictException("Cannot merge profile into itself: " + sourceProfileId);
        }
        try (LogContext logCtx = LogContext.forMerge(
                LogContext.generateCorrelationId(), sourceProfileId, targetProfileId);
             Span span = tracingService.startSpan("profile.merge",
                     Map.of("sourceProfileId", sourceProfileId, "targetProfileId", targetProfileId))) {
            Profile source = profileRepository.findById(sourceProfileId)
                    .orElseThrow(() -> new NotFoundException("Profile", sourceProfileId));
            Profile target = profileRepository.findById(targetProfileId)
                    .orElseThrow(() -> new NotFoundException("Profile", targetProfileId));
            log.info("merge.starting sourceProfileId={} targetProfileId={} triggeredBy={}",
                    sourceProfileId, targetProfileId, triggeredBy);

            Profile sourceSnapshot = Profile.builder(source).build();
            Profile targetSnapshot = Profile.builder(target).build();
            List<String> identifierIds = new ArrayList<>();
            List<String> repointed = new ArrayList<>();

            try (MergeTransaction tx = new MergeTransaction()) {
                tx.execute("reassign identifiers",
                        () -> identifierIds.addAll(
                                identifierRepository.reassignProfile(sourceProfileId, targetProfileId)),
                        () -> identifierRepository.assignProfile(identifierIds, sourceProfileId));

                tx.execute("absorb source fields",
                        () -> {
                            target.absorb(source, clock.instant());
                            profileRepository.save(target);
                        },
                        () -> profileRepository.save(targetSnapshot));

                tx.execute("re-point leads",
                        () -> repointed.addAll(leadRepository.reassignProfile(sourceProfileId, targetProfileId)),
                        () -> leadRepository.assignProfile(repointed, sourceProfileId));

                tx.execute("delete source profile",
                        () -> profileRepository.delete(sourceProfileId),
                        () -> profileRepository.save(sourceSnapshot));

                tx.executeNoCompensation("audit merge",
                        () -> auditService.record(AuditAction.PROFILE_MERGED, sourceProfileId, triggeredBy, Map.of(
                                "targetProfileId", targetProfileId,
                                "identifiersMoved", identifierIds.size(),
                                "leadsRepointed", repointed.size())));

                tx.markSuccess();
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("merge.failed sourceProfileId={} targetProfileId={} error={}",
                        sourceProfileId, targetProfileId, e.getMessage());
                throw new LeadDiscoveryException("Merge of " + sourceProfileId + " into "
                        + targetProfileId + " failed and was rolled back", e);
            }

            metricsService.incrementProfileMerged();
            span.setAttribute("identifiersMoved", identifierIds.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("merge.completed sourceProfileId={} targetProfileId={} identifiers={} leads={}",
                    sourceProfileId, targetProfileId, identifierIds.size(), repointed.size());

            notifyMergeListeners(sourceProfileId, targetProfileId);
            return new MergeResult(target, sourceProfileId, identifierIds, repointed);
        }
    }

    public void addMergeListener(MergeListener listener) {
        if (listener != null) {
            mergeListeners.add(listener);
        }
    }

    private void notifyMergeListeners(String sourceProfileId, String targetProfileId) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(sourceProfileId, targetProfileId);
            } catch (RuntimeException e) {
                log.warn("merge.listener.failed listener={} error={}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
