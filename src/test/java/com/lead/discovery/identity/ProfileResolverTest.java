package com.lead.discovery.identity;

import com.lead.discovery.MutableClock;
import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.ConflictException;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Identifier;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.core.model.Profile;
import com.lead.discovery.lead.InMemoryLeadRepository;
import com.lead.discovery.merge.MergeResult;
import com.lead.discovery.merge.ProfileMergeEngine;
import com.lead.discovery.metrics.NoOpMetricsService;
import com.lead.discovery.privacy.PrivacyMode;
import com.lead.discovery.privacy.PrivacyPolicy;
import com.lead.discovery.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ProfileResolverTest {

    private InMemoryIdentifierRepository identifierRepository;
    private InMemoryProfileRepository profileRepository;
    private AuditService auditService;
    private AtomicReference<PrivacyPolicy> policy;
    private MutableClock clock;
    private IdentifierStore store;
    private ProfileResolver resolver;

    @BeforeEach
    void setUp() {
        identifierRepository = new InMemoryIdentifierRepository();
        profileRepository = new InMemoryProfileRepository();
        auditService = new AuditService();
        policy = new AtomicReference<>(PrivacyPolicy.defaults());
        clock = MutableClock.at("2026-02-01T09:00:00Z");
        NoOpMetricsService metrics = new NoOpMetricsService();
        store = new IdentifierStore(identifierRepository, policy::get, auditService, metrics, clock);
        ProfileMergeEngine mergeEngine = new ProfileMergeEngine(profileRepository, identifierRepository,
                new InMemoryLeadRepository(), auditService, metrics, new NoOpTracingService(), clock);
        resolver = new ProfileResolver(store, identifierRepository, profileRepository, mergeEngine,
                policy::get, auditService, metrics, clock);
    }

    @Nested
    @DisplayName("Building profiles")
    class Building {

        @Test
        @DisplayName("Same identifier set in any order resolves to one profile")
        void buildIsOrderIndependent() {
            String email = store.trackIdentifier(IdentifierType.EMAIL, "jane@acme.com");
            String phone = store.trackIdentifier(IdentifierType.PHONE, "5551234567");

            String first = resolver.buildProfile(List.of(email, phone));
            String second = resolver.buildProfile(List.of(phone, email));

            assertEquals(first, second);
            assertEquals(1, profileRepository.count());
            Profile profile = resolver.getProfile(first);
            assertEquals("jane@acme.com", profile.getEmail());
            assertEquals("5551234567", profile.getPhone());
            assertEquals(first, store.getById(email).getProfileId());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.PROFILE_CREATED).size());
        }

        @Test
        @DisplayName("Concurrent builds of the same set create one profile")
        void concurrentBuilds() throws Exception {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            String b = store.trackIdentifier(IdentifierType.COOKIE, "b");
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Callable<String>> tasks = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    tasks.add(() -> resolver.buildProfile(List.of(a, b)));
                }
                Set<String> ids = new java.util.HashSet<>();
                for (Future<String> future : executor.invokeAll(tasks)) {
                    ids.add(future.get());
                }
                assertEquals(1, ids.size());
                assertEquals(1, profileRepository.count());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void emptySet_rejected() {
            assertThrows(ValidationException.class, () -> resolver.buildProfile(List.of()));
            assertThrows(ValidationException.class, () -> resolver.buildProfile(null));
        }

        @Test
        void unknownIdentifier_notFound() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            assertThrows(NotFoundException.class, () -> resolver.buildProfile(List.of(a, "nope")));
        }

        @Test
        @DisplayName("Identifiers owned by another profile keep their owner")
        void ownedIdentifiersKeepOwner() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            String b = store.trackIdentifier(IdentifierType.COOKIE, "b");
            String first = resolver.buildProfile(List.of(a));

            String second = resolver.buildProfile(List.of(a, b));

            assertNotEquals(first, second);
            assertEquals(first, store.getById(a).getProfileId());
            assertEquals(second, store.getById(b).getProfileId());
        }

        @Test
        @DisplayName("A set owned entirely by other profiles resolves to the earliest owner")
        void fullyOwnedSetReturnsEarliestOwner() {
            String a = store.trackIdentifier(IdentifierType.EMAIL, "a@x.io");
            String b = store.trackIdentifier(IdentifierType.EMAIL, "b@x.io");
            String first = resolver.buildProfile(List.of(a));
            clock.advance(Duration.ofMinutes(5));
            String second = resolver.buildProfile(List.of(b));

            String resolved = resolver.buildProfile(List.of(b, a));

            assertEquals(first, resolved);
            assertEquals(2, profileRepository.count());
            assertEquals(first, store.getById(a).getProfileId());
            assertEquals(second, store.getById(b).getProfileId());
            assertEquals(2, auditService.getEntriesByAction(AuditAction.PROFILE_CREATED).size());
        }

        @Test
        @DisplayName("A new profile copies contact fields only from the identifiers it takes")
        void newProfileCopiesOnlyTakenContacts() {
            String owned = store.trackIdentifier(IdentifierType.EMAIL, "owned@x.io");
            String phone = store.trackIdentifier(IdentifierType.PHONE, "5551234567");
            resolver.buildProfile(List.of(owned));

            Profile created = resolver.getProfile(resolver.buildProfile(List.of(owned, phone)));

            assertNull(created.getEmail());
            assertEquals("5551234567", created.getPhone());
            assertEquals(created.getId(), store.getById(phone).getProfileId());
        }
    }

    @Nested
    @DisplayName("Linking")
    class Linking {

        @Test
        void linkToExistingProfile() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a", "https://one.example", Map.of());
            String profileId = resolver.buildProfile(List.of(a));
            String email = store.trackIdentifier(IdentifierType.EMAIL, "x@y.io", "https://two.example", Map.of());

            resolver.linkIdentifiers(List.of(email), profileId);

            Profile profile = resolver.getProfile(profileId);
            assertEquals("x@y.io", profile.getEmail());
            assertEquals(Set.of("https://one.example", "https://two.example"), profile.getSitesVisited());
            assertEquals(profile.getId(),
                    resolver.getProfileByIdentifier(IdentifierType.EMAIL, "x@y.io").orElseThrow().getId());
        }

        @Test
        void identifierOwnedElsewhere_conflict() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            String b = store.trackIdentifier(IdentifierType.COOKIE, "b");
            resolver.buildProfile(List.of(a));
            String other = resolver.buildProfile(List.of(b));

            assertThrows(ConflictException.class, () -> resolver.linkIdentifiers(List.of(a), other));
        }

        @Test
        void nullProfile_buildsNewOne() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            String profileId = resolver.linkIdentifiers(List.of(a), null);
            assertEquals(profileId, store.getById(a).getProfileId());
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Target survives and owns every identifier of the source")
        void targetSurvives() {
            String a = store.trackIdentifier(IdentifierType.EMAIL, "a@x.io");
            String b = store.trackIdentifier(IdentifierType.PHONE, "5550001111");
            String source = resolver.buildProfile(List.of(a));
            String target = resolver.buildProfile(List.of(b));
            resolver.trackBehavior(source, "page_view");
            resolver.trackBehavior(target, "page_view");

            MergeResult result = resolver.mergeProfiles(source, target);

            assertEquals(target, result.survivorId());
            assertEquals(source, result.mergedProfileId());
            assertTrue(resolver.findProfile(source).isEmpty());
            assertEquals(target, store.getById(a).getProfileId());
            Profile survivor = resolver.getProfile(target);
            assertEquals("a@x.io", survivor.getEmail());
            assertEquals(2, survivor.getBehaviorCounts().get("page_view"));
        }

        @Test
        @DisplayName("Merge order does not change where identifiers end up")
        void mergeIsAssociative() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            String b = store.trackIdentifier(IdentifierType.COOKIE, "b");
            String c = store.trackIdentifier(IdentifierType.COOKIE, "c");
            String pa = resolver.buildProfile(List.of(a));
            String pb = resolver.buildProfile(List.of(b));
            String pc = resolver.buildProfile(List.of(c));

            resolver.mergeProfiles(pa, pb);
            resolver.mergeProfiles(pb, pc);

            for (String id : List.of(a, b, c)) {
                assertEquals(pc, store.getById(id).getProfileId());
            }
            assertEquals(1, profileRepository.count());
            // rebuilding an original set after the merge resolves to the survivor
            assertEquals(pc, resolver.buildProfile(List.of(a)));
        }

        @Test
        @DisplayName("Survivor's updatedAt comes from the injected clock")
        void mergeStampsClockTime() {
            String source = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "a")));
            String target = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "b")));
            clock.advance(Duration.ofHours(3));

            resolver.mergeProfiles(source, target);

            assertEquals(clock.instant(), resolver.getProfile(target).getUpdatedAt());
        }

        @Test
        @DisplayName("Anonymizing after a merge keeps the survivor as owner")
        void anonymizeAfterMergeKeepsSurvivor() {
            String a = store.trackIdentifier(IdentifierType.EMAIL, "a@x.io");
            String source = resolver.buildProfile(List.of(a));
            String target = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "t")));

            resolver.mergeProfiles(source, target);
            store.anonymizeIdentifier(a);

            Identifier identifier = store.getById(a);
            assertTrue(identifier.isAnonymized());
            assertEquals(target, identifier.getProfileId());
            assertTrue(store.getProfileIdentifiers(target).stream().anyMatch(i -> i.getId().equals(a)));
        }

        @Test
        @DisplayName("Cross-site tracking after a merge keeps the owner and the sighting count")
        void crossSiteAfterMergeKeepsOwnerAndCount() {
            policy.set(PrivacyPolicy.of(PrivacyMode.PERMISSIVE));
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            store.trackIdentifier(IdentifierType.COOKIE, "a");
            String source = resolver.buildProfile(List.of(a));
            String target = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "t")));
            resolver.mergeProfiles(source, target);

            assertTrue(resolver.trackCrossSite(a, "https://three.example"));

            Identifier identifier = store.getById(a);
            assertEquals(target, identifier.getProfileId());
            assertEquals(2, identifier.getSeenCount());
            assertTrue(resolver.getProfile(target).getSitesVisited().contains("https://three.example"));
        }

        @Test
        void mergeIntoSelf_conflict() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            String p = resolver.buildProfile(List.of(a));
            assertThrows(ConflictException.class, () -> resolver.mergeProfiles(p, p));
        }

        @Test
        void mergeUnknown_notFound() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a");
            String p = resolver.buildProfile(List.of(a));
            assertThrows(NotFoundException.class, () -> resolver.mergeProfiles("missing", p));
        }

        @Test
        void listenersNotified() {
            List<String> seen = new ArrayList<>();
            resolver.addMergeListener((source, target) -> seen.add(source + "->" + target));
            String pa = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "a")));
            String pb = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "b")));

            resolver.mergeProfiles(pa, pb);

            assertEquals(List.of(pa + "->" + pb), seen);
        }
    }

    @Nested
    @DisplayName("Duplicate detection")
    class Duplicates {

        private String older;
        private String newer;

        @BeforeEach
        void twoProfilesSharingTwoValues() {
            String c1 = store.trackIdentifier(IdentifierType.COOKIE, "shared-1");
            String c2 = store.trackIdentifier(IdentifierType.COOKIE, "shared-2");
            older = resolver.buildProfile(List.of(c1, c2));
            clock.advance(Duration.ofHours(1));
            String t1 = store.trackIdentifier(IdentifierType.TRACKING_ID, "shared-1");
            String t2 = store.trackIdentifier(IdentifierType.TRACKING_ID, "shared-2");
            newer = resolver.buildProfile(List.of(t1, t2));
        }

        @Test
        void pairsAboveThreshold() {
            List<DuplicateProfilePair> pairs = resolver.findDuplicateProfiles(2);

            assertEquals(1, pairs.size());
            assertEquals(2, pairs.get(0).sharedIdentifiers());
            assertEquals(Set.of(older, newer), Set.of(pairs.get(0).firstProfileId(), pairs.get(0).secondProfileId()));
            assertTrue(resolver.findDuplicateProfiles(3).isEmpty());
        }

        @Test
        void thresholdBelowOne_rejected() {
            assertThrows(ValidationException.class, () -> resolver.findDuplicateProfiles(0));
        }

        @Test
        @DisplayName("Sweep keeps the earliest-created profile")
        void mergeDuplicatesKeepsOldest() {
            List<MergeResult> results = resolver.mergeDuplicates(2);

            assertEquals(1, results.size());
            assertEquals(older, results.get(0).survivorId());
            assertTrue(resolver.findProfile(newer).isEmpty());
            assertTrue(resolver.findDuplicateProfiles(1).isEmpty());
        }
    }

    @Nested
    @DisplayName("Behavior and privacy")
    class BehaviorAndPrivacy {

        @Test
        void trackBehaviorCounts() {
            String p = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "a")));
            assertEquals(1, resolver.trackBehavior(p, "loan_calculator"));
            assertEquals(2, resolver.trackBehavior(p, "loan_calculator"));
            assertThrows(ValidationException.class, () -> resolver.trackBehavior(p, " "));
            assertThrows(NotFoundException.class, () -> resolver.trackBehavior("missing", "x"));
        }

        @Test
        @DisplayName("Fingerprinting is skipped unless the policy allows it")
        void fingerprintingFollowsPolicy() {
            Map<String, Object> browser = Map.of("userAgent", "Mozilla/5.0", "screenResolution", "1920x1080");

            assertTrue(resolver.fingerprintDevice(browser, null).isEmpty());
            assertEquals(0, store.getIdentifierStats().totalIdentifiers());

            policy.set(PrivacyPolicy.builder().mode(PrivacyMode.STANDARD).fingerprintingEnabled(true).build());
            String p = resolver.buildProfile(List.of(store.trackIdentifier(IdentifierType.COOKIE, "a")));
            String fingerprintId = resolver.fingerprintDevice(browser, p).orElseThrow();

            assertEquals(IdentifierType.FINGERPRINT, store.getById(fingerprintId).getType());
            assertEquals(p, store.getById(fingerprintId).getProfileId());
            assertNotNull(resolver.getProfile(p).getDeviceFingerprint());
            // same browser, same fingerprint
            assertEquals(fingerprintId, resolver.fingerprintDevice(browser, null).orElseThrow());
        }

        @Test
        void crossSiteFollowsPolicy() {
            String a = store.trackIdentifier(IdentifierType.COOKIE, "a", "https://one.example", Map.of());
            String p = resolver.buildProfile(List.of(a));

            assertFalse(resolver.trackCrossSite(a, "https://two.example"));

            policy.set(PrivacyPolicy.of(PrivacyMode.PERMISSIVE));
            assertTrue(resolver.trackCrossSite(a, "https://two.example"));
            assertTrue(store.getById(a).getSitesSeenOn().contains("https://two.example"));
            assertTrue(resolver.getProfile(p).getSitesVisited().contains("https://two.example"));
        }
    }
}
