package com.lead.discovery.identity;

import com.lead.discovery.audit.AuditAction;
import com.lead.discovery.audit.AuditService;
import com.lead.discovery.core.exception.ConflictException;
import com.lead.discovery.core.exception.NotFoundException;
import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Identifier;
import com.lead.discovery.core.model.IdentifierType;
import com.lead.discovery.core.model.Profile;
import com.lead.discovery.merge.MergeListener;
import com.lead.discovery.merge.MergeResult;
import com.lead.discovery.merge.ProfileMergeEngine;
import com.lead.discovery.metrics.MetricsService;
import com.lead.discovery.privacy.PrivacyPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Correlates identifiers into {@link Profile}s.
 *
 * <p>A profile is keyed by the digest of the identifier-id set it was built from, so
 * building the same set twice, in any order and from any number of threads, resolves to
 * one profile. Near-duplicate sets are not merged automatically; they surface through
 * {@link #findDuplicateProfiles(int)} and are reconciled with an explicit merge.</p>
 */
public class ProfileResolver {
    private static final Logger log = LoggerFactory.getLogger(ProfileResolver.class);

    static final String MERGE_DUPLICATES_ACTOR = "DUPLICATE_SWEEP";

    private final IdentifierStore identifierStore;
    private final IdentifierRepository identifierRepository;
    private final ProfileRepository profileRepository;
    private final ProfileMergeEngine mergeEngine;
    private final Supplier<PrivacyPolicy> privacyPolicy;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;

    public ProfileResolver(IdentifierStore identifierStore,
                           IdentifierRepository identifierRepository,
                           ProfileRepository profileRepository,
                           ProfileMergeEngine mergeEngine,
                           Supplier<PrivacyPolicy> privacyPolicy,
                           AuditService auditService,
                           MetricsService metricsService,
                           Clock clock) {
        this.identifierStore = identifierStore;
        this.identifierRepository = identifierRepository;
        this.profileRepository = profileRepository;
        this.mergeEngine = mergeEngine;
        this.privacyPolicy = privacyPolicy;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Resolves the identifier set to a profile id, creating the profile on first build.
     * Identifiers already owned by another profile keep their owner, and the new profile
     * takes only the unowned ones. When every identifier already has an owner, no profile
     * is created and the earliest-created owner is returned.
     *
     * @throws ValidationException if the set is empty
     * @throws NotFoundException   if an identifier id is unknown
     */
    public String buildProfile(Collection<String> identifierIds) {
        Set<String> ids = normalize(identifierIds);
        String profileHash = IdentifierHasher.profileHash(ids);

        Optional<Profile> existing = profileRepository.findByHash(profileHash);
        if (existing.isPresent()) {
            log.debug("profile.build.existing profileId={} identifiers={}", existing.get().getId(), ids.size());
            return existing.get().getId();
        }

        List<Identifier> identifiers = load(ids);
        Map<String, Profile> owners = new HashMap<>();
        List<Identifier> unowned = new ArrayList<>();
        for (Identifier identifier : identifiers) {
            Optional<Profile> owner = identifier.isLinked()
                    ? Optional.ofNullable(owners.get(identifier.getProfileId()))
                            .or(() -> profileRepository.findById(identifier.getProfileId()))
                    : Optional.empty();
            if (owner.isPresent()) {
                owners.put(owner.get().getId(), owner.get());
            } else {
                unowned.add(identifier);
            }
        }
        if (unowned.isEmpty()) {
            String ownerId = owners.values().stream()
                    .reduce(ProfileResolver::survivorOf)
                    .map(Profile::getId)
                    .orElseThrow();
            log.debug("profile.build.owned profileId={} identifiers={} owners={}", ownerId, ids.size(), owners.size());
            return ownerId;
        }

        Instant now = clock.instant();
        Profile candidate = newProfile(profileHash, unowned, now);
        Profile stored = profileRepository.createIfAbsent(candidate);
        if (!stored.getId().equals(candidate.getId())) {
            // lost the race to a concurrent build of the same set
            return stored.getId();
        }

        List<String> taken = unowned.stream().map(Identifier::getId).toList();
        identifierRepository.assignProfile(taken, stored.getId());
        metricsService.incrementProfileCreated();
        auditService.record(AuditAction.PROFILE_CREATED, stored.getId(), Map.of(
                "identifiers", ids.size(),
                "linked", taken.size()));
        log.info("profile.created profileId={} identifiers={} linked={}", stored.getId(), ids.size(), taken.size());
        return stored.getId();
    }

    /**
     * Attaches identifiers to an existing profile, or builds a new one when
     * {@code profileId} is null.
     *
     * @throws NotFoundException if the profile or an identifier does not exist
     * @throws ConflictException if an identifier already belongs to a different profile
     */
    public String linkIdentifiers(Collection<String> identifierIds, String profileId) {
        if (profileId == null) {
            return buildProfile(identifierIds);
        }
        Set<String> ids = normalize(identifierIds);
        Profile profile = getProfile(profileId);
        List<Identifier> identifiers = load(ids);
        for (Identifier identifier : identifiers) {
            if (identifier.isLinked() && !profileId.equals(identifier.getProfileId())) {
                throw new ConflictException("Identifier " + identifier.getId()
                        + " already belongs to profile " + identifier.getProfileId());
            }
        }
        identifierRepository.assignProfile(ids, profileId);
        for (Identifier identifier : identifiers) {
            identifier.getSitesSeenOn().forEach(profile::addSite);
            fillContact(profile, identifier);
        }
        profileRepository.save(profile);
        auditService.record(AuditAction.IDENTIFIERS_LINKED, profileId, Map.of("identifiers", ids.size()));
        log.info("profile.linked profileId={} identifiers={}", profileId, ids.size());
        return profileId;
    }

    /**
     * Profile pairs sharing at least {@code minSharedIdentifiers} equal identifier hashes,
     * most shared first.
     */
    public List<DuplicateProfilePair> findDuplicateProfiles(int minSharedIdentifiers) {
        if (minSharedIdentifiers < 1) {
            throw new ValidationException("minSharedIdentifiers must be at least 1");
        }
        return identifierRepository.findProfilesSharingHashes(minSharedIdentifiers);
    }

    /**
     * Merges {@code sourceProfileId} into {@code targetProfileId}; the target survives.
     */
    public MergeResult mergeProfiles(String sourceProfileId, String targetProfileId) {
        return mergeEngine.merge(sourceProfileId, targetProfileId, AuditService.SYSTEM_ACTOR);
    }

    /**
     * Finds duplicate pairs and merges each, keeping the earliest-created profile of a pair
     * (ties broken by id). Pairs whose profiles were already merged away in this sweep are
     * skipped, and a failed pair does not stop the sweep.
     */
    public List<MergeResult> mergeDuplicates(int minSharedIdentifiers) {
        List<MergeResult> results = new ArrayList<>();
        for (DuplicateProfilePair pair : findDuplicateProfiles(minSharedIdentifiers)) {
            Optional<Profile> first = profileRepository.findById(pair.firstProfileId());
            Optional<Profile> second = profileRepository.findById(pair.secondProfileId());
            if (first.isEmpty() || second.isEmpty()) {
                log.debug("profile.dedupe.skipped first={} second={}", pair.firstProfileId(), pair.secondProfileId());
                continue;
            }
            Profile survivor = survivorOf(first.get(), second.get());
            Profile merged = survivor == first.get() ? second.get() : first.get();
            try {
                results.add(mergeEngine.merge(merged.getId(), survivor.getId(), MERGE_DUPLICATES_ACTOR));
            } catch (RuntimeException e) {
                log.warn("profile.dedupe.failed source={} target={} error={}",
                        merged.getId(), survivor.getId(), e.getMessage());
            }
        }
        log.info("profile.dedupe.completed merged={}", results.size());
        return results;
    }

    static Profile survivorOf(Profile a, Profile b) {
        Comparator<Profile> order = Comparator.comparing(Profile::getCreatedAt).thenComparing(Profile::getId);
        return order.compare(a, b) <= 0 ? a : b;
    }

    /**
     * Increments the profile's counter for {@code behaviorType}.
     *
     * @return the new count
     */
    public int trackBehavior(String profileId, String behaviorType) {
        if (behaviorType == null || behaviorType.isBlank()) {
            throw new ValidationException("behaviorType must not be blank");
        }
        Profile profile = getProfile(profileId);
        int count = profile.incrementBehavior(behaviorType);
        profileRepository.save(profile);
        log.debug("profile.behavior profileId={} type={} count={}", profileId, behaviorType, count);
        return count;
    }

    /**
     * Digests the browser characteristics into a {@code fingerprint} identifier and, when a
     * profile is given, stores the digest on it. Skipped when the privacy policy disallows
     * fingerprinting.
     *
     * @return the fingerprint identifier id, empty when skipped
     */
    public Optional<String> fingerprintDevice(Map<String, Object> browserData, String profileId) {
        if (!privacyPolicy.get().allowsFingerprinting()) {
            log.debug("profile.fingerprint.skipped reason=privacy profileId={}", profileId);
            return Optional.empty();
        }
        Profile profile = profileId != null ? getProfile(profileId) : null;
        DeviceFingerprint fingerprint = DeviceFingerprint.fromBrowserData(browserData);
        String digest = fingerprint.digest();
        Identifier identifier = identifierStore.observe(IdentifierType.FINGERPRINT, digest, null,
                Map.of("userAgent", fingerprint.userAgent())).identifier();
        if (profile != null) {
            profile.setDeviceFingerprint(digest);
            profileRepository.save(profile);
            if (!identifier.isLinked()) {
                identifierRepository.assignProfile(List.of(identifier.getId()), profileId);
            }
        }
        log.debug("profile.fingerprinted identifierId={} profileId={}", identifier.getId(), profileId);
        return Optional.of(identifier.getId());
    }

    /**
     * Records that the identifier was seen on {@code siteUrl}, on the identifier and on its
     * profile. Skipped when cross-site correlation is disallowed.
     *
     * @return true if the site was recorded
     */
    public boolean trackCrossSite(String identifierId, String siteUrl) {
        if (!privacyPolicy.get().allowsCrossSiteTracking()) {
            log.debug("profile.crosssite.skipped reason=privacy identifierId={}", identifierId);
            return false;
        }
        if (siteUrl == null || siteUrl.isBlank()) {
            throw new ValidationException("siteUrl must not be blank");
        }
        Identifier identifier = identifierRepository.addSite(identifierId, siteUrl)
                .orElseThrow(() -> new NotFoundException("Identifier", identifierId));
        if (identifier.isLinked()) {
            profileRepository.findById(identifier.getProfileId()).ifPresent(profile -> {
                profile.addSite(siteUrl);
                profileRepository.save(profile);
            });
        }
        log.debug("profile.crosssite identifierId={} site={}", identifierId, siteUrl);
        return true;
    }

    public Profile getProfile(String profileId) {
        return profileRepository.findById(profileId)
                .orElseThrow(() -> new NotFoundException("Profile", profileId));
    }

    public Optional<Profile> findProfile(String profileId) {
        return profileRepository.findById(profileId);
    }

    public Optional<Profile> getProfileByIdentifier(IdentifierType type, String rawValue) {
        return identifierStore.getIdentifier(type, rawValue)
                .map(Identifier::getProfileId)
                .flatMap(profileRepository::findById);
    }

    public void addMergeListener(MergeListener listener) {
        mergeEngine.addMergeListener(listener);
    }

    private Set<String> normalize(Collection<String> identifierIds) {
        if (identifierIds == null || identifierIds.isEmpty()) {
            throw new ValidationException("Identifier set must not be empty");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : identifierIds) {
            if (id != null && !id.isBlank()) {
                ids.add(id);
            }
        }
        if (ids.isEmpty()) {
            throw new ValidationException("Identifier set must not be empty");
        }
        return ids;
    }

    private List<Identifier> load(Set<String> ids) {
        List<Identifier> identifiers = identifierRepository.findByIds(ids);
        if (identifiers.size() != ids.size()) {
            Set<String> missing = new LinkedHashSet<>(ids);
            identifiers.forEach(i -> missing.remove(i.getId()));
            throw new NotFoundException("Identifier", String.join(",", missing));
        }
        return identifiers;
    }

    private Profile newProfile(String profileHash, List<Identifier> identifiers, Instant now) {
        Profile profile = Profile.builder()
                .profileHash(profileHash)
                .createdAt(now)
                .updatedAt(now)
                .build();
        for (Identifier identifier : identifiers) {
            identifier.getSitesSeenOn().forEach(profile::addSite);
            fillContact(profile, identifier);
        }
        return profile;
    }

    private static void fillContact(Profile profile, Identifier identifier) {
        if (identifier.isAnonymized()) {
            return;
        }
        if (identifier.getType() == IdentifierType.EMAIL && profile.getEmail() == null) {
            profile.setEmail(identifier.getRawValue());
        } else if (identifier.getType() == IdentifierType.PHONE && profile.getPhone() == null) {
            profile.setPhone(identifier.getRawValue());
        } else if (identifier.getType() == IdentifierType.FINGERPRINT && profile.getDeviceFingerprint() == null) {
            profile.setDeviceFingerprint(identifier.getRawValue());
        }
    }
}
