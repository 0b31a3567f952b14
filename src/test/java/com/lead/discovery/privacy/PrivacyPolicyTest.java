package com.lead.discovery.privacy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PrivacyPolicyTest {

    @Test
    void modeParsing() {
        assertEquals(PrivacyMode.STRICT, PrivacyMode.parse("GDPR"));
        assertEquals(PrivacyMode.STRICT, PrivacyMode.parse("gdpr_strict"));
        assertEquals(PrivacyMode.PERMISSIVE, PrivacyMode.parse("testing"));
        assertEquals(PrivacyMode.STANDARD, PrivacyMode.parse("whatever"));
        assertEquals(PrivacyMode.STANDARD, PrivacyMode.parse(null));
    }

    @Test
    void consentByMode() {
        PrivacyPolicy standard = PrivacyPolicy.defaults();
        assertTrue(standard.requiresConsent(TrackingKind.FINGERPRINTING));
        assertFalse(standard.requiresConsent(TrackingKind.COOKIES));
        assertTrue(PrivacyPolicy.of(PrivacyMode.STRICT).requiresConsent(TrackingKind.COOKIES));
        assertFalse(PrivacyPolicy.of(PrivacyMode.PERMISSIVE).requiresConsent(TrackingKind.FINGERPRINTING));
        assertFalse(PrivacyPolicy.builder().mode(PrivacyMode.STRICT).requireConsent(false).build()
                .requiresConsent(TrackingKind.COOKIES));
    }

    @Test
    void anonymizationByMode() {
        assertTrue(PrivacyPolicy.of(PrivacyMode.STRICT).shouldAnonymize(SensitiveField.EMAIL));
        assertTrue(PrivacyPolicy.defaults().shouldAnonymize(SensitiveField.IDENTIFIER));
        assertFalse(PrivacyPolicy.defaults().shouldAnonymize(SensitiveField.PHONE));
        assertTrue(PrivacyPolicy.of(PrivacyMode.PERMISSIVE).shouldAnonymize(SensitiveField.IP_ADDRESS));
        assertFalse(PrivacyPolicy.of(PrivacyMode.PERMISSIVE).shouldAnonymize(SensitiveField.IDENTIFIER));
    }

    @Test
    void retentionTable() {
        assertEquals(14, PrivacyPolicy.of(PrivacyMode.STRICT).retentionDays(DataCategory.ANALYTICS));
        assertEquals(730, PrivacyPolicy.defaults().retentionDays(DataCategory.LEADS));
        assertEquals(1825, PrivacyPolicy.of(PrivacyMode.PERMISSIVE).retention(DataCategory.LEADS).toDays());
    }

    @Test
    void trackingSwitches() {
        assertFalse(PrivacyPolicy.defaults().allowsFingerprinting());
        assertTrue(PrivacyPolicy.builder().fingerprintingEnabled(true).build().allowsFingerprinting());
        assertTrue(PrivacyPolicy.of(PrivacyMode.PERMISSIVE).allowsCrossSiteTracking());
        assertEquals(PrivacyMode.STRICT, PrivacyPolicy.defaults().withMode(PrivacyMode.STRICT).mode());
    }
}
