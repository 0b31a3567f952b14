package com.lead.discovery.core.exception;

/**
 * Thrown when a requested change conflicts with the current state,
 * e.g. merging a profile into itself or an illegal alert status transition.
 */
public class ConflictException extends LeadDiscoveryException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
