package com.lead.discovery.geo;

/**
 * The three location forms the parser recognizes.
 */
public enum LocationKind {
    COORDINATES,
    POSTAL_CODE,
    TEXT
}
