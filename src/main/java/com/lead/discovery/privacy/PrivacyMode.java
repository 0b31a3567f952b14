package com.lead.discovery.privacy;

import java.util.Locale;

/**
 * Jurisdiction profile the engine runs under.
 */
public enum PrivacyMode {
    /** GDPR-style: consent for all non-essential tracking, short retention. */
    STRICT,
    STANDARD,
    /** Minimal restrictions, meant for test and research environments. */
    PERMISSIVE;

    /**
     * Lenient parse accepting the common aliases; unknown values fall back to STANDARD.
     */
    public static PrivacyMode parse(String value) {
        if (value == null) {
            return STANDARD;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "strict", "gdpr", "gdpr_strict" -> STRICT;
            case "permissive", "testing", "test" -> PERMISSIVE;
            default -> STANDARD;
        };
    }
}
