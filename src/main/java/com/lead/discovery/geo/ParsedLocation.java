package com.lead.discovery.geo;

import java.util.Objects;

/**
 * A parsed location string. Only the fields of its {@link LocationKind} are set.
 */
public record ParsedLocation(
        LocationKind kind,
        Double latitude,
        Double longitude,
        String postalCode,
        String city,
        String state,
        String country
) {
    public ParsedLocation {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static ParsedLocation coordinates(double latitude, double longitude) {
        return new ParsedLocation(LocationKind.COORDINATES, latitude, longitude, null, null, null, null);
    }

    public static ParsedLocation postalCode(String postalCode) {
        return new ParsedLocation(LocationKind.POSTAL_CODE, null, null, postalCode, null, null, null);
    }

    public static ParsedLocation text(String city, String state, String country) {
        return new ParsedLocation(LocationKind.TEXT, null, null, null, city, state, country);
    }

    public boolean hasCoordinates() {
        return kind == LocationKind.COORDINATES;
    }
}
