package com.lead.discovery.core.exception;

/**
 * Base class for domain failures raised by the lead discovery engine.
 */
public class LeadDiscoveryException extends RuntimeException {

    public LeadDiscoveryException(String message) {
        super(message);
    }

    public LeadDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
