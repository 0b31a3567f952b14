package com.lead.discovery.core.exception;

/**
 * Thrown when an operation references an identifier, profile, lead, match or alert
 * that does not exist in the system of record.
 */
public class NotFoundException extends LeadDiscoveryException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
