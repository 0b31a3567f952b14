package com.lead.discovery.lead;

import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.ConflictException;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.LeadStatus;
import com.lead.discovery.core.model.LeadType;
import com.lead.discovery.core.model.Signal;
import com.lead.discovery.geo.GeographicIndex;
import com.lead.discovery.geo.ParsedLocation;
import com.lead.discovery.signal.SignalAggregator;
import com.lead.discovery.signal.SignalDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw lead data plus observed content into a stored {@link Lead}: detects signals,
 * derives signal strength, intent score and needs, and normalizes the location.
 */
public class LeadBuilder {
    private static final Logger log = LoggerFactory.getLogger(LeadBuilder.class);

    private final LeadRepository leadRepository;
    private final SignalDetector signalDetector;
    private final GeographicIndex geographicIndex;
    private final AuditService auditService;

    public LeadBuilder(LeadRepository leadRepository, SignalDetector signalDetector,
                       GeographicIndex geographicIndex, AuditService auditService) {
        this.leadRepository = leadRepository;
        this.signalDetector = signalDetector;
        this.geographicIndex = geographicIndex;
        this.auditService = auditService;
    }

    public Lead build(Lead.Builder draft, String content, Map<String, Object> behavior) {
        return build(draft, null, content, behavior);
    }

    /**
     * Builds and persists a new lead with status NEW.
     *
     * @param draft    contact, company and location fields already known
     * @param location optional free-text location; when given it fills the draft's location fields
     * @param content  observed text to scan for signals, may be null
     * @param behavior observed behavior payload, may be null
     * @throws ValidationException if the location string cannot be parsed
     */
    public Lead build(Lead.Builder draft, String location, String content, Map<String, Object> behavior) {
        Objects.requireNonNull(draft, "draft is required");
        if (location != null && !location.isBlank()) {
            applyLocation(draft, geographicIndex.parseLocation(location));
        }

        List<Signal> signals = signalDetector.detect(content, behavior);
        Lead lead = draft
                .signals(signals)
                .signalStrength(SignalAggregator.aggregateStrength(signals))
                .intentScore(SignalAggregator.intentScore(signals))
                .needsIdentified(SignalAggregator.needsIdentified(signals))
                .status(LeadStatus.NEW)
                .build();

        leadRepository.save(lead);
        auditService.record(AuditAction.LEAD_CREATED, lead.getId(), Map.of(
                "type", lead.getType().name(),
                "signals", signals.size(),
                "intentScore", lead.getIntentScore()));
        log.info("lead.created id={} type={} signals={} strength={} intent={}",
                lead.getId(), lead.getType(), signals.size(), lead.getSignalStrength(), lead.getIntentScore());
        return lead;
    }

    /**
     * Creates a business lead from a directory listing. Listings carry no observed content,
     * so the lead starts without signals.
     */
    public Lead createBusinessLead(BusinessListing listing, String leadCategory) {
        Lead.Builder draft = Lead.builder()
                .type(LeadType.BUSINESS)
                .name(listing.getBusinessName())
                .company(listing.getBusinessName())
                .phone(listing.getPhone())
                .email(listing.getEmail())
                .website(listing.getWebsite())
                .address(listing.getAddress())
                .city(listing.getCity())
                .state(listing.getState())
                .country(listing.getCountry())
                .postalCode(listing.getPostalCode())
                .latitude(listing.getLatitude())
                .longitude(listing.getLongitude())
                .industry(listing.getIndustry())
                .leadCategory(leadCategory)
                .source(listing.getSource());
        return build(draft, null, null, null);
    }

    /**
     * Applies whitelisted enrichment fields.
     *
     * @return false when nothing applicable was supplied
     * @throws NotFoundException if the lead does not exist
     * @throws ValidationException if a field value has the wrong shape
     */
    public boolean enrichLead(String leadId, LeadEnrichment enrichment) {
        Lead lead = getLead(leadId);
        if (!enrichment.ignoredFields().isEmpty()) {
            log.debug("lead.enrich.ignored id={} fields={}", leadId, enrichment.ignoredFields());
        }
        if (enrichment.isEmpty()) {
            return false;
        }
        try {
            enrichment.applyTo(lead);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid enrichment for lead " + leadId + ": " + e.getMessage(), e);
        }
        leadRepository.save(lead);
        auditService.record(AuditAction.LEAD_ENRICHED, leadId,
                Map.of("fields", String.join(",", enrichment.applicableFields().keySet())));
        log.info("lead.enriched id={} fields={}", leadId, enrichment.applicableFields().keySet());
        return true;
    }

    public boolean enrichLead(String leadId, Map<String, ?> data) {
        return enrichLead(leadId, LeadEnrichment.of(data));
    }

    /**
     * Moves a lead to a new status. Setting the current status again is a no-op.
     *
     * @throws ConflictException if the lead is already LOST or INVALID
     */
    public Lead updateStatus(String leadId, LeadStatus status) {
        Objects.requireNonNull(status, "status is required");
        Lead lead = getLead(leadId);
        LeadStatus previous = lead.getStatus();
        if (previous == status) {
            return lead;
        }
        if (previous.isTerminal()) {
            throw new ConflictException("Lead " + leadId + " is " + previous + " and cannot move to " + status);
        }
        lead.setStatus(status);
        leadRepository.save(lead);
        auditService.record(AuditAction.LEAD_STATUS_CHANGED, leadId,
                Map.of("from", previous.name(), "to", status.name()));
        log.info("lead.status_changed id={} from={} to={}", leadId, previous, status);
        return lead;
    }

    public Lead getLead(String leadId) {
        return leadRepository.findById(leadId)
                .orElseThrow(() -> new NotFoundException("Lead", leadId));
    }

    public Optional<Lead> findLead(String leadId) {
        return leadRepository.findById(leadId);
    }

    private static void applyLocation(Lead.Builder draft, ParsedLocation location) {
        switch (location.kind()) {
            case COORDINATES -> draft.latitude(location.latitude()).longitude(location.longitude());
            case POSTAL_CODE -> draft.postalCode(location.postalCode());
            case TEXT -> draft.city(location.city()).state(location.state()).country(location.country());
        }
    }
}
