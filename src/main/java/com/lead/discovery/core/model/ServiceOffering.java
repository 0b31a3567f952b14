package com.lead.discovery.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Catalog entry matched against leads. Owned by the external catalog and read-only here.
 */
public final class ServiceOffering {
    private final String id;
    private final String serviceName;
    private final String serviceType;
    private final String serviceCategory;
    private final String description;
    private final List<String> targetLocations;
    private final List<String> targetIndustries;
    private final TargetAudience targetAudience;
    private final List<String> targetCompanySizes;
    private final Map<String, Object> requirements;
    private final boolean active;

    private ServiceOffering(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.serviceName = builder.serviceName;
        this.serviceType = builder.serviceType;
        this.serviceCategory = builder.serviceCategory;
        this.description = builder.description;
        this.targetLocations = List.copyOf(builder.targetLocations);
        this.targetIndustries = List.copyOf(builder.targetIndustries);
        this.targetAudience = builder.targetAudience;
        this.targetCompanySizes = List.copyOf(builder.targetCompanySizes);
        this.requirements = Map.copyOf(builder.requirements);
        this.active = builder.active;
    }

    public String getId() {
        return id;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getServiceType() {
        return serviceType;
    }

    public String getServiceCategory() {
        return serviceCategory;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTargetLocations() {
        return targetLocations;
    }

    public List<String> getTargetIndustries() {
        return targetIndustries;
    }

    public TargetAudience getTargetAudience() {
        return targetAudience;
    }

    public List<String> getTargetCompanySizes() {
        return targetCompanySizes;
    }

    public Map<String, Object> getRequirements() {
        return requirements;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceOffering that = (ServiceOffering) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ServiceOffering{" +
                "id='" + id + '\'' +
                ", serviceName='" + serviceName + '\'' +
                ", serviceType='" + serviceType + '\'' +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String serviceName;
        private String serviceType;
        private String serviceCategory;
        private String description;
        private List<String> targetLocations = List.of();
        private List<String> targetIndustries = List.of();
        private TargetAudience targetAudience = TargetAudience.BOTH;
        private List<String> targetCompanySizes = List.of();
        private Map<String, Object> requirements = Map.of();
        private boolean active = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder serviceType(String serviceType) {
            this.serviceType = serviceType;
            return this;
        }

        public Builder serviceCategory(String serviceCategory) {
            this.serviceCategory = serviceCategory;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder targetLocations(List<String> targetLocations) {
            this.targetLocations = targetLocations != null ? targetLocations : List.of();
            return this;
        }

        public Builder targetIndustries(List<String> targetIndustries) {
            this.targetIndustries = targetIndustries != null ? targetIndustries : List.of();
            return this;
        }

        public Builder targetAudience(TargetAudience targetAudience) {
            this.targetAudience = targetAudience != null ? targetAudience : TargetAudience.BOTH;
            return this;
        }

        public Builder targetCompanySizes(List<String> targetCompanySizes) {
            this.targetCompanySizes = targetCompanySizes != null ? targetCompanySizes : List.of();
            return this;
        }

        public Builder requirements(Map<String, Object> requirements) {
            this.requirements = requirements != null ? requirements : Map.of();
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public ServiceOffering build() {
            Objects.requireNonNull(serviceName, "serviceName is required");
            Objects.requireNonNull(serviceType, "serviceType is required");
            return new ServiceOffering(this);
        }
    }
}
