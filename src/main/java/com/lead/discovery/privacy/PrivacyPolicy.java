package com.lead.discovery.privacy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable privacy configuration consulted before fingerprinting, cross-site correlation,
 * anonymization and retention sweeps. Passed explicitly to the components that need it.
 *
 * @param mode                     jurisdiction profile
 * @param requireConsent           master switch for consent requirements
 * @param anonymizeData            master switch for anonymization
 * @param crossSiteTrackingEnabled forces cross-site correlation on regardless of mode
 * @param fingerprintingEnabled    forces device fingerprinting on regardless of mode
 */
public record PrivacyPolicy(
        PrivacyMode mode,
        boolean requireConsent,
        boolean anonymizeData,
        boolean crossSiteTrackingEnabled,
        boolean fingerprintingEnabled
) {
    private static final Map<PrivacyMode, Map<DataCategory, Integer>> RETENTION_DAYS = retentionTable();

    public PrivacyPolicy {
        Objects.requireNonNull(mode, "mode is required");
    }

    /**
     * Mode defaults: consent and anonymization on, explicit tracking switches off.
     */
    public static PrivacyPolicy of(PrivacyMode mode) {
        return new PrivacyPolicy(mode, true, true, false, false);
    }

    public static PrivacyPolicy defaults() {
        return of(PrivacyMode.STANDARD);
    }

    public boolean allowsFingerprinting() {
        return fingerprintingEnabled || mode == PrivacyMode.PERMISSIVE;
    }

    public boolean allowsCrossSiteTracking() {
        return crossSiteTrackingEnabled || mode == PrivacyMode.PERMISSIVE;
    }

    public boolean requiresConsent(TrackingKind kind) {
        if (!requireConsent) {
            return false;
        }
        return switch (mode) {
            case STRICT -> true;
            case STANDARD -> kind == TrackingKind.FINGERPRINTING
                    || kind == TrackingKind.CROSS_SITE_TRACKING
                    || kind == TrackingKind.BEHAVIORAL_TRACKING;
            case PERMISSIVE -> false;
        };
    }

    public boolean shouldAnonymize(SensitiveField field) {
        if (!anonymizeData) {
            return false;
        }
        return switch (mode) {
            case STRICT -> true;
            case STANDARD -> field == SensitiveField.IP_ADDRESS || field == SensitiveField.IDENTIFIER;
            case PERMISSIVE -> field == SensitiveField.IP_ADDRESS;
        };
    }

    public int retentionDays(DataCategory category) {
        return RETENTION_DAYS.get(mode).get(category);
    }

    public Duration retention(DataCategory category) {
        return Duration.ofDays(retentionDays(category));
    }

    public PrivacyPolicy withMode(PrivacyMode newMode) {
        return new PrivacyPolicy(newMode, requireConsent, anonymizeData, crossSiteTrackingEnabled, fingerprintingEnabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<PrivacyMode, Map<DataCategory, Integer>> retentionTable() {
        Map<PrivacyMode, Map<DataCategory, Integer>> table = new EnumMap<>(PrivacyMode.class);
        table.put(PrivacyMode.STRICT, days(30, 90, 180, 30, 14, 30));
        table.put(PrivacyMode.STANDARD, days(90, 365, 730, 180, 90, 90));
        table.put(PrivacyMode.PERMISSIVE, days(365, 730, 1825, 365, 365, 365));
        return table;
    }

    private static Map<DataCategory, Integer> days(int cookies, int profiles, int leads,
                                                  int tracking, int analytics, int other) {
        Map<DataCategory, Integer> days = new EnumMap<>(DataCategory.class);
        days.put(DataCategory.COOKIES, cookies);
        days.put(DataCategory.PROFILES, profiles);
        days.put(DataCategory.LEADS, leads);
        days.put(DataCategory.TRACKING, tracking);
        days.put(DataCategory.ANALYTICS, analytics);
        days.put(DataCategory.OTHER, other);
        return days;
    }

    public static class Builder {
        private PrivacyMode mode = PrivacyMode.STANDARD;
        private boolean requireConsent = true;
        private boolean anonymizeData = true;
        private boolean crossSiteTrackingEnabled = false;
        private boolean fingerprintingEnabled = false;

        public Builder mode(PrivacyMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder requireConsent(boolean requireConsent) {
            this.requireConsent = requireConsent;
            return this;
        }

        public Builder anonymizeData(boolean anonymizeData) {
            this.anonymizeData = anonymizeData;
            return this;
        }

        public Builder crossSiteTrackingEnabled(boolean enabled) {
            this.crossSiteTrackingEnabled = enabled;
            return this;
        }

        public Builder fingerprintingEnabled(boolean enabled) {
            this.fingerprintingEnabled = enabled;
            return this;
        }

        public PrivacyPolicy build() {
            return new PrivacyPolicy(mode, requireConsent, anonymizeData, crossSiteTrackingEnabled, fingerprintingEnabled);
        }
    }
}
