package com.lead.discovery.geo;

import com.lead.discovery.core.exception.ValidationException;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses location strings. Exactly three forms are recognized, tried in this order:
 * <ul>
 *   <li>decimal {@code "lat,lng"}, e.g. {@code "30.2672,-97.7431"}</li>
 *   <li>5 or 9 digit postal code, e.g. {@code "78701"} or {@code "78701-1234"}</li>
 *   <li>{@code "City, State[, Country]"}, the country falling back to the configured default</li>
 * </ul>
 */
public class LocationParser {

    public static final String DEFAULT_COUNTRY = "US";

    private static final Pattern COORDINATES = Pattern.compile("^(-?\\d+\\.\\d+),\\s*(-?\\d+\\.\\d+)$");
    private static final Pattern POSTAL_CODE = Pattern.compile("^\\d{5}(-\\d{4})?$");

    private final String defaultCountry;

    public LocationParser() {
        this(DEFAULT_COUNTRY);
    }

    public LocationParser(String defaultCountry) {
        this.defaultCountry = defaultCountry;
    }

    /**
     * @throws ValidationException if the string is blank, has coordinates out of range,
     *                             or has no city part
     */
    public ParsedLocation parse(String location) {
        if (location == null || location.isBlank()) {
            throw new ValidationException("Location must not be blank");
        }
        String trimmed = location.trim();

        Matcher coordinates = COORDINATES.matcher(trimmed);
        if (coordinates.matches()) {
            double latitude = Double.parseDouble(coordinates.group(1));
            double longitude = Double.parseDouble(coordinates.group(2));
            if (latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
                throw new ValidationException("Coordinates out of range: " + trimmed);
            }
            return ParsedLocation.coordinates(latitude, longitude);
        }

        if (POSTAL_CODE.matcher(trimmed).matches()) {
            return ParsedLocation.postalCode(trimmed);
        }

        String[] parts = Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .toArray(String[]::new);
        if (parts.length == 0 || parts[0].isEmpty()) {
            throw new ValidationException("Malformed location: " + location);
        }
        String city = parts[0];
        String state = parts.length >= 2 && !parts[1].isEmpty() ? parts[1] : null;
        String country = parts.length >= 3 && !parts[2].isEmpty() ? parts[2] : defaultCountry;
        return ParsedLocation.text(city, state, country);
    }

    public String getDefaultCountry() {
        return defaultCountry;
    }
}
