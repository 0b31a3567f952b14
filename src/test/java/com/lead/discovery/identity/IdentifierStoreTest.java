package com.lead.discovery.identity;

import com.lead.discovery.MutableClock;
import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Identifier;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.metrics.NoOpMetricsService;
import com.lead.discovery.privacy.PrivacyMode;
import com.lead.discovery.privacy.PrivacyPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierStoreTest {

    private InMemoryIdentifierRepository repository;
    private AuditService auditService;
    private AtomicReference<PrivacyPolicy> policy;
    private MutableClock clock;
    private IdentifierStore store;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIdentifierRepository();
        auditService = new AuditService();
        policy = new AtomicReference<>(PrivacyPolicy.defaults());
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        store = new IdentifierStore(repository, policy::get, auditService, new NoOpMetricsService(), clock);
    }

    @Nested
    @DisplayName("Tracking")
    class Tracking {

        @Test
        @DisplayName("Tracking the same value twice yields one identifier with a higher count")
        void trackIsIdempotent() {
            String first = store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com");
            clock.advance(Duration.ofMinutes(5));
            String second = store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com");

            assertEquals(first, second);
            Identifier identifier = store.getById(first);
            assertEquals(2, identifier.getSeenCount());
            assertEquals(clock.instant(), identifier.getLastSeen());
            assertTrue(identifier.getFirstSeen().isBefore(identifier.getLastSeen()));
        }

        @Test
        @DisplayName("Same value under two types creates two identifiers")
        void sameValueDifferentTypes() {
            String cookie = store.trackIdentifier(IdentifierType.COOKIE, "abc123");
            String tracking = store.trackIdentifier(IdentifierType.TRACKING_ID, "abc123");

            assertNotEquals(cookie, tracking);
            assertEquals(store.getById(cookie).getHash(), store.getById(tracking).getHash());
            assertEquals(2, store.getIdentifierStats().totalIdentifiers());
        }

        @Test
        @DisplayName("Surrounding whitespace does not create a new identifier")
        void valueIsTrimmed() {
            String a = store.trackIdentifier(IdentifierType.PHONE, "5551234567");
            String b = store.trackIdentifier(IdentifierType.PHONE, "  5551234567 ");
            assertEquals(a, b);
        }

        @Test
        @DisplayName("Hash is the SHA-256 hex digest of the value")
        void hashIsSha256() {
            String id = store.trackIdentifier(IdentifierType.COOKIE, "abc");
            assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                    store.getById(id).getHash());
        }

        @Test
        void blankValue_rejected() {
            assertThrows(ValidationException.class, () -> store.trackIdentifier(IdentifierType.EMAIL, "  "));
            assertThrows(ValidationException.class, () -> store.trackIdentifier(null, "x"));
            assertEquals(0, store.getIdentifierStats().totalIdentifiers());
        }

        @Test
        @DisplayName("Additional sites are only recorded when cross-site tracking is allowed")
        void additionalSitesFollowPrivacy() {
            String id = store.trackIdentifier(IdentifierType.COOKIE, "v1", "https://a.example", Map.of());
            store.trackIdentifier(IdentifierType.COOKIE, "v1", "https://b.example", Map.of());
            assertEquals(Set.of("https://a.example"), store.getById(id).getSitesSeenOn());

            policy.set(PrivacyPolicy.of(PrivacyMode.PERMISSIVE));
            store.trackIdentifier(IdentifierType.COOKIE, "v1", "https://b.example", Map.of());
            assertEquals(Set.of("https://a.example", "https://b.example"), store.getById(id).getSitesSeenOn());
        }

        @Test
        void trackCookies_storesNameEqualsValue() {
            Map<String, String> cookies = new LinkedHashMap<>();
            cookies.put("_ga", "GA1.2.3");
            cookies.put("theme", "dark");

            List<String> ids = store.trackCookies("https://shop.example", cookies);

            assertEquals(2, ids.size());
            assertTrue(store.getIdentifier(IdentifierType.COOKIE, "_ga=GA1.2.3").isPresent());
            assertEquals("theme", store.getById(ids.get(1)).getMetadata().get("cookieName"));
        }
    }

    @Test
    @DisplayName("Extraction tracks each distinct match once")
    void extractAndTrack() {
        ObservedContent content = new ObservedContent("https://acme.example",
                "Mail JANE@acme.com or jane@acme.com, call 555-123-4567",
                Map.of("_ga", "GA1.2.99"),
                List.of(Map.of("user_id", "u-42")));

        List<Identifier> tracked = store.extractAndTrack(content);

        assertEquals(4, tracked.size());
        assertTrue(store.getIdentifier(IdentifierType.EMAIL, "jane@acme.com").isPresent());
        assertTrue(store.getIdentifier(IdentifierType.PHONE, "5551234567").isPresent());
        assertTrue(store.getIdentifier(IdentifierType.TRACKING_ID, "GA1.2.99").isPresent());
        assertTrue(store.getIdentifier(IdentifierType.USER_ID, "u-42").isPresent());
    }

    @Nested
    @DisplayName("Privacy operations")
    class PrivacyOperations {

        @Test
        @DisplayName("Anonymize replaces the raw value and keeps the hash")
        void anonymizeKeepsHash() {
            String id = store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com");
            String hash = store.getById(id).getHash();

            Identifier anonymized = store.anonymizeIdentifier(id);

            assertEquals(Identifier.ANONYMIZED_VALUE, anonymized.getRawValue());
            assertEquals(hash, store.getById(id).getHash());
            assertTrue(store.getById(id).isAnonymized());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.IDENTIFIER_ANONYMIZED).size());

            // observation by the original value still correlates
            assertEquals(id, store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com"));
        }

        @Test
        @DisplayName("Anonymize leaves ownership and sighting count as stored")
        void anonymizeKeepsOwnerAndCount() {
            String id = store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com");
            repository.assignProfile(List.of(id), "profile-1");
            store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com");
            repository.reassignProfile("profile-1", "profile-2");

            Identifier anonymized = store.anonymizeIdentifier(id);

            assertEquals("profile-2", anonymized.getProfileId());
            assertEquals(2, anonymized.getSeenCount());
            assertEquals("profile-2", store.getById(id).getProfileId());
            assertThrows(NotFoundException.class, () -> store.anonymizeIdentifier("missing"));
        }

        @Test
        void delete_removesAndAudits() {
            String id = store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com");
            store.deleteIdentifier(id);

            assertThrows(NotFoundException.class, () -> store.getById(id));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.IDENTIFIER_DELETED).size());
        }

        @Test
        void deleteUnknown_throwsNotFound() {
            assertThrows(NotFoundException.class, () -> store.deleteIdentifier("missing"));
        }

        @Test
        @DisplayName("Cleanup deletes only unlinked identifiers older than the window")
        void cleanupOldIdentifiers() {
            String old = store.trackIdentifier(IdentifierType.COOKIE, "old");
            String linked = store.trackIdentifier(IdentifierType.COOKIE, "linked");
            repository.assignProfile(List.of(linked), "profile-1");
            clock.advance(Duration.ofDays(40));
            String fresh = store.trackIdentifier(IdentifierType.COOKIE, "fresh");

            long removed = store.cleanupOldIdentifiers(30);

            assertEquals(1, removed);
            assertThrows(NotFoundException.class, () -> store.getById(old));
            assertNotNull(store.getById(linked));
            assertNotNull(store.getById(fresh));
        }

        @Test
        void cleanupNegativeDays_rejected() {
            assertThrows(ValidationException.class, () -> store.cleanupOldIdentifiers(-1));
        }
    }

    @Test
    void stats_countByType() {
        store.trackIdentifier(IdentifierType.COOKIE, "a");
        store.trackIdentifier(IdentifierType.COOKIE, "a");
        store.trackIdentifier(IdentifierType.EMAIL, "b@c.io");

        IdentifierStats stats = store.getIdentifierStats();

        assertEquals(2, stats.totalIdentifiers());
        assertEquals(2, stats.distinctTypes());
        assertEquals(2, stats.unlinkedIdentifiers());
        assertEquals(1.5, stats.averageSeenCount(), 0.001);
        assertEquals(1L, stats.countsByType().get(IdentifierType.EMAIL));
    }
}
