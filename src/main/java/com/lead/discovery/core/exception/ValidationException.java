package com.lead.discovery.core.exception;

/**
 * Thrown on malformed input such as an unparseable location or an empty identifier set.
 */
public class ValidationException extends LeadDiscoveryException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
