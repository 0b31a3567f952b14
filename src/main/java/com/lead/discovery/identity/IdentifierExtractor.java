package com.lead.discovery.identity;

import com.lead.discovery.core.model.IdentifierType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds identifier values in observed content. Each library (email, phone, user id,
 * tracking cookies, structured-event keys) runs independently; a value found by more
 * than one is reported once per (type, value).
 */
public class IdentifierExtractor {

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE = Pattern.compile("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b");
    private static final List<Pattern> USER_ID_PATTERNS = List.of(
            Pattern.compile("user[_-]?id[\"\\s:=]+([a-zA-Z0-9-]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("customer[_-]?id[\"\\s:=]+([a-zA-Z0-9-]+)", Pattern.CASE_INSENSITIVE)
    );

    static final List<String> TRACKING_COOKIE_NAMES = List.of(
            "_ga", "_gid", "fbp", "fr", "_fbp", "ide", "visitor_id", "session_id", "tracking_id");

    public List<ExtractedIdentifier> extract(ObservedContent content) {
        Map<String, ExtractedIdentifier> found = new LinkedHashMap<>();
        extractFromText(content.text(), found);
        extractFromCookies(content.cookies(), found);
        for (Map<String, Object> event : content.events()) {
            extractFromEvent(event, found);
        }
        return new ArrayList<>(found.values());
    }

    private void extractFromText(String text, Map<String, ExtractedIdentifier> found) {
        if (text.isEmpty()) {
            return;
        }
        Matcher email = EMAIL.matcher(text);
        while (email.find()) {
            add(found, IdentifierType.EMAIL, email.group().toLowerCase(Locale.ROOT), "text");
        }
        Matcher phone = PHONE.matcher(text);
        while (phone.find()) {
            add(found, IdentifierType.PHONE, phone.group().replaceAll("\\D", ""), "text");
        }
        for (Pattern pattern : USER_ID_PATTERNS) {
            Matcher userId = pattern.matcher(text);
            while (userId.find()) {
                add(found, IdentifierType.USER_ID, userId.group(1), "text");
            }
        }
    }

    private void extractFromCookies(Map<String, String> cookies, Map<String, ExtractedIdentifier> found) {
        cookies.forEach((name, value) -> {
            if (name != null && isTrackingCookie(name)) {
                add(found, IdentifierType.TRACKING_ID, value, "cookie:" + name);
            }
        });
    }

    private void extractFromEvent(Map<?, ?> event, Map<String, ExtractedIdentifier> found) {
        for (Map.Entry<?, ?> entry : event.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                extractFromEvent(nested, found);
            } else if (value instanceof List<?> items) {
                for (Object item : items) {
                    if (item instanceof Map<?, ?> nested) {
                        extractFromEvent(nested, found);
                    }
                }
            } else if (value != null && isIdKey(key)) {
                add(found, idKeyType(key), String.valueOf(value), "event:" + key);
            }
        }
    }

    static boolean isTrackingCookie(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return TRACKING_COOKIE_NAMES.stream().anyMatch(lower::contains);
    }

    static boolean isIdKey(String key) {
        return key.endsWith("_id") || (key.length() > 2 && key.endsWith("Id"));
    }

    private static IdentifierType idKeyType(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return lower.contains("user") || lower.contains("customer") ? IdentifierType.USER_ID : IdentifierType.TRACKING_ID;
    }

    private static void add(Map<String, ExtractedIdentifier> found, IdentifierType type, String value, String source) {
        if (value == null || value.isBlank()) {
            return;
        }
        found.putIfAbsent(type.name() + ':' + value, new ExtractedIdentifier(type, value, source));
    }
}
