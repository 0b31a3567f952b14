package com.lead.discovery.identity;

import com.lead.discovery.core.model.IdentifierType;

import java.util.Objects;

/**
 * An identifier value found in observed content, before it is tracked.
 *
 * @param source where it was found, e.g. {@code text}, {@code cookie:_ga}, {@code event:user_id}
 */
public record ExtractedIdentifier(IdentifierType type, String value, String source) {

    public ExtractedIdentifier {
        Objects.requireNonNull(type, "type is required");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }
}
