package com.lead.discovery.core.model;

import java.util.Locale;

/**
 * Kinds of observed identifiers. The same raw value under two different types
 * yields two distinct identifiers.
 */
public enum IdentifierType {
    COOKIE,
    EMAIL,
    PHONE,
    USER_ID,
    TRACKING_ID,
    FINGERPRINT;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IdentifierType fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
