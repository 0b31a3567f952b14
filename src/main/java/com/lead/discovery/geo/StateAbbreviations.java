package com.lead.discovery.geo;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * US state names and their postal abbreviations.
 */
public final class StateAbbreviations {

    private static final Map<String, String> CODES_BY_NAME = codesByName();
    private static final Map<String, String> NAMES_BY_CODE = namesByCode();

    private StateAbbreviations() {
    }

    /**
     * Two-letter code for a state name or code, case-insensitive.
     */
    public static Optional<String> abbreviationOf(String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }
        String key = state.trim().toLowerCase(Locale.ROOT);
        String code = CODES_BY_NAME.get(key);
        if (code != null) {
            return Optional.of(code);
        }
        String upper = key.toUpperCase(Locale.ROOT);
        return NAMES_BY_CODE.containsKey(upper) ? Optional.of(upper) : Optional.empty();
    }

    /**
     * Lower-case full name for a state name or code.
     */
    public static Optional<String> nameOf(String state) {
        return abbreviationOf(state).map(NAMES_BY_CODE::get);
    }

    /**
     * True when both denote the same state, e.g. {@code "TX"} and {@code "Texas"}.
     * Unknown values fall back to case-insensitive equality.
     */
    public static boolean sameState(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        Optional<String> codeA = abbreviationOf(a);
        Optional<String> codeB = abbreviationOf(b);
        if (codeA.isPresent() && codeB.isPresent()) {
            return codeA.get().equals(codeB.get());
        }
        return a.trim().equalsIgnoreCase(b.trim());
    }

    private static Map<String, String> codesByName() {
        Map<String, String> names = new HashMap<>();
        names.put("alabama", "AL");
        names.put("alaska", "AK");
        names.put("arizona", "AZ");
        names.put("arkansas", "AR");
        names.put("california", "CA");
        names.put("colorado", "CO");
        names.put("connecticut", "CT");
        names.put("delaware", "DE");
        names.put("district of columbia", "DC");
        names.put("florida", "FL");
        names.put("georgia", "GA");
        names.put("hawaii", "HI");
        names.put("idaho", "ID");
        names.put("illinois", "IL");
        names.put("indiana", "IN");
        names.put("iowa", "IA");
        names.put("kansas", "KS");
        names.put("kentucky", "KY");
        names.put("louisiana", "LA");
        names.put("maine", "ME");
        names.put("maryland", "MD");
        names.put("massachusetts", "MA");
        names.put("michigan", "MI");
        names.put("minnesota", "MN");
        names.put("mississippi", "MS");
        names.put("missouri", "MO");
        names.put("montana", "MT");
        names.put("nebraska", "NE");
        names.put("nevada", "NV");
        names.put("new hampshire", "NH");
        names.put("new jersey", "NJ");
        names.put("new mexico", "NM");
        names.put("new york", "NY");
        names.put("north carolina", "NC");
        names.put("north dakota", "ND");
        names.put("ohio", "OH");
        names.put("oklahoma", "OK");
        names.put("oregon", "OR");
        names.put("pennsylvania", "PA");
        names.put("rhode island", "RI");
        names.put("south carolina", "SC");
        names.put("south dakota", "SD");
        names.put("tennessee", "TN");
        names.put("texas", "TX");
        names.put("utah", "UT");
        names.put("vermont", "VT");
        names.put("virginia", "VA");
        names.put("washington", "WA");
        names.put("west virginia", "WV");
        names.put("wisconsin", "WI");
        names.put("wyoming", "WY");
        return Collections.unmodifiableMap(names);
    }

    private static Map<String, String> namesByCode() {
        Map<String, String> codes = new HashMap<>();
        CODES_BY_NAME.forEach((name, code) -> codes.put(code, name));
        return Collections.unmodifiableMap(codes);
    }
}
