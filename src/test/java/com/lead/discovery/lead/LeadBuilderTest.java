package com.lead.discovery.lead;

import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.ConflictException;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.LeadStatus;
import com.lead.discovery.core.model.LeadType;
import com.lead.discovery.geo.GeographicIndex;
import com.lead.discovery.geo.LocationParser;
import com.lead.discovery.signal.SignalDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LeadBuilderTest {

    private InMemoryLeadRepository leadRepository;
    private AuditService auditService;
    private LeadBuilder builder;

    @BeforeEach
    void setUp() {
        leadRepository = new InMemoryLeadRepository();
        auditService = new AuditService();
        builder = new LeadBuilder(leadRepository, new SignalDetector(),
                new GeographicIndex(new LocationParser()), auditService);
    }

    @Nested
    @DisplayName("Building leads")
    class Building {

        @Test
        @DisplayName("Signals drive strength, intent and needs")
        void signalsAreAggregated() {
            Lead lead = builder.build(Lead.builder().name("Jane"),
                    "We need a business loan urgently, about $50,000.", null);

            assertEquals(1, lead.getSignals().size());
            assertEquals(85, lead.getSignalStrength());
            assertEquals(70, lead.getIntentScore());
            assertEquals(Set.of("business_loan"), lead.getNeedsIdentified());
            assertEquals(LeadStatus.NEW, lead.getStatus());
            assertTrue(leadRepository.findById(lead.getId()).isPresent());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.LEAD_CREATED).size());
        }

        @Test
        void noContentMeansNoSignals() {
            Lead lead = builder.build(Lead.builder().name("Quiet"), null, null);

            assertTrue(lead.getSignals().isEmpty());
            assertEquals(0, lead.getSignalStrength());
            assertEquals(0, lead.getIntentScore());
            assertTrue(lead.getNeedsIdentified().isEmpty());
        }

        @Test
        void locationFillsTheDraft() {
            Lead text = builder.build(Lead.builder().name("A"), "Austin, TX", null, null);
            assertEquals("Austin", text.getCity());
            assertEquals("TX", text.getState());
            assertEquals("US", text.getCountry());

            Lead postal = builder.build(Lead.builder().name("B"), "78701", null, null);
            assertEquals("78701", postal.getPostalCode());

            Lead point = builder.build(Lead.builder().name("C"), "30.2672,-97.7431", null, null);
            assertEquals(30.2672, point.getLatitude(), 1e-9);
            assertEquals(-97.7431, point.getLongitude(), 1e-9);
        }

        @Test
        void malformedLocation_validation() {
            assertThrows(ValidationException.class,
                    () -> builder.build(Lead.builder().name("X"), "95.0,10.0", null, null));
            assertEquals(0, leadRepository.count());
        }

        @Test
        void businessLeadFromListing() {
            BusinessListing listing = BusinessListing.builder()
                    .businessName("Acme Plumbing")
                    .businessType("plumber")
                    .industry("construction")
                    .city("Austin")
                    .state("TX")
                    .phone("5125550100")
                    .source("yellow-pages")
                    .build();

            Lead lead = builder.createBusinessLead(listing, "trades");

            assertEquals(LeadType.BUSINESS, lead.getType());
            assertEquals("Acme Plumbing", lead.getCompany());
            assertEquals("construction", lead.getIndustry());
            assertEquals("trades", lead.getLeadCategory());
            assertEquals("yellow-pages", lead.getSource());
            assertTrue(lead.getSignals().isEmpty());
        }
    }

    @Nested
    @DisplayName("Enrichment")
    class Enrichment {

        @Test
        @DisplayName("Only whitelisted fields are applied")
        void whitelist() {
            Lead lead = builder.build(Lead.builder().name("Acme"), null, null);
            Map<String, Object> data = new HashMap<>();
            data.put("email", "info@acme.io");
            data.put("employee_count", "42");
            data.put("name", "Renamed");
            data.put("phone", null);

            assertTrue(builder.enrichLead(lead.getId(), data));

            Lead stored = builder.getLead(lead.getId());
            assertEquals("info@acme.io", stored.getEmail());
            assertEquals(42, stored.getEmployeeCount());
            assertEquals("Acme", stored.getName());
            assertNull(stored.getPhone());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.LEAD_ENRICHED).size());
        }

        @Test
        void nothingApplicable_returnsFalse() {
            Lead lead = builder.build(Lead.builder().name("Acme"), null, null);

            assertFalse(builder.enrichLead(lead.getId(), Map.of("favourite_colour", "blue")));
            assertFalse(builder.enrichLead(lead.getId(), (Map<String, ?>) null));
            assertTrue(auditService.getEntriesByAction(AuditAction.LEAD_ENRICHED).isEmpty());
        }

        @Test
        void badEmployeeCount_validation() {
            Lead lead = builder.build(Lead.builder().name("Acme"), null, null);

            assertThrows(ValidationException.class,
                    () -> builder.enrichLead(lead.getId(), Map.of("employee_count", "lots")));
        }

        @Test
        void unknownLead_notFound() {
            assertThrows(NotFoundException.class, () -> builder.enrichLead("missing", Map.of("email", "a@b.c")));
        }

        @Test
        void ignoredFieldsAreReported() {
            LeadEnrichment enrichment = LeadEnrichment.of(Map.of("company", "Acme", "score", 10));

            assertEquals(Map.of("company", "Acme"), enrichment.applicableFields());
            assertEquals(Set.of("score"), enrichment.ignoredFields());
        }
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        void changesAreAudited() {
            Lead lead = builder.build(Lead.builder().name("Acme"), null, null);

            builder.updateStatus(lead.getId(), LeadStatus.CONTACTED);
            builder.updateStatus(lead.getId(), LeadStatus.CONTACTED);

            assertEquals(LeadStatus.CONTACTED, builder.getLead(lead.getId()).getStatus());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.LEAD_STATUS_CHANGED).size());
        }

        @Test
        void terminalStatusIsFinal() {
            Lead lead = builder.build(Lead.builder().name("Acme"), null, null);
            builder.updateStatus(lead.getId(), LeadStatus.LOST);

            assertThrows(ConflictException.class, () -> builder.updateStatus(lead.getId(), LeadStatus.INTERESTED));
        }

        @Test
        void unknownLead() {
            assertThrows(NotFoundException.class, () -> builder.updateStatus("missing", LeadStatus.CONTACTED));
            assertTrue(builder.findLead("missing").isEmpty());
        }
    }
}
