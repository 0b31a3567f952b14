package com.lead.discovery.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A discovered prospect carrying location, industry, need and signal data.
 * Subject of matching against service offerings.
 */
public class Lead implements Locatable {
    private final String id;
    private final LeadType type;
    private String name;
    private String email;
    private String phone;
    private String company;
    private String website;
    private String address;
    private String city;
    private String state;
    private String country;
    private String postalCode;
    private Double latitude;
    private Double longitude;
    private String industry;
    private String companySize;
    private String revenueRange;
    private Integer employeeCount;
    private String leadCategory;
    private final String source;
    private final List<Signal> signals;
    private int signalStrength;
    private int intentScore;
    private final Set<String> needsIdentified;
    private LeadStatus status;
    private String profileId;
    private final Instant createdAt;
    private Instant updatedAt;

    private Lead(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.name = builder.name;
        this.email = builder.email;
        this.phone = builder.phone;
        this.company = builder.company;
        this.website = builder.website;
        this.address = builder.address;
        this.city = builder.city;
        this.state = builder.state;
        this.country = builder.country;
        this.postalCode = builder.postalCode;
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.industry = builder.industry;
        this.companySize = builder.companySize;
        this.revenueRange = builder.revenueRange;
        this.employeeCount = builder.employeeCount;
        this.leadCategory = builder.leadCategory;
        this.source = builder.source;
        this.signals = new ArrayList<>(builder.signals);
        this.signalStrength = builder.signalStrength;
        this.intentScore = builder.intentScore;
        this.needsIdentified = new LinkedHashSet<>(builder.needsIdentified);
        this.status = builder.status != null ? builder.status : LeadStatus.NEW;
        this.profileId = builder.profileId;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public LeadType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getCompany() {
        return company;
    }

    public String getWebsite() {
        return website;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public String getCity() {
        return city;
    }

    @Override
    public String getState() {
        return state;
    }

    @Override
    public String getCountry() {
        return country;
    }

    @Override
    public String getPostalCode() {
        return postalCode;
    }

    @Override
    public Double getLatitude() {
        return latitude;
    }

    @Override
    public Double getLongitude() {
        return longitude;
    }

    @Override
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public String getIndustry() {
        return industry;
    }

    public String getCompanySize() {
        return companySize;
    }

    public String getRevenueRange() {
        return revenueRange;
    }

    public Integer getEmployeeCount() {
        return employeeCount;
    }

    public String getLeadCategory() {
        return leadCategory;
    }

    public String getSource() {
        return source;
    }

    public List<Signal> getSignals() {
        return List.copyOf(signals);
    }

    public int getSignalStrength() {
        return signalStrength;
    }

    public int getIntentScore() {
        return intentScore;
    }

    public Set<String> getNeedsIdentified() {
        return Set.copyOf(needsIdentified);
    }

    public LeadStatus getStatus() {
        return status;
    }

    public String getProfileId() {
        return profileId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Display label used in alert messages: the person's name, else the company.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : company;
    }

    public boolean isEligibleForMatching() {
        return !status.isTerminal();
    }

    public void setEmail(String email) {
        this.email = email;
        touch();
    }

    public void setPhone(String phone) {
        this.phone = phone;
        touch();
    }

    public void setCompany(String company) {
        this.company = company;
        touch();
    }

    public void setWebsite(String website) {
        this.website = website;
        touch();
    }

    public void setIndustry(String industry) {
        this.industry = industry;
        touch();
    }

    public void setCompanySize(String companySize) {
        this.companySize = companySize;
        touch();
    }

    public void setRevenueRange(String revenueRange) {
        this.revenueRange = revenueRange;
        touch();
    }

    public void setEmployeeCount(Integer employeeCount) {
        this.employeeCount = employeeCount;
        touch();
    }

    public void setStatus(LeadStatus status) {
        this.status = status;
        touch();
    }

    public void setProfileId(String profileId) {
        this.profileId = profileId;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lead lead = (Lead) o;
        return Objects.equals(id, lead.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Lead{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", name='" + displayName() + '\'' +
                ", city='" + city + '\'' +
                ", state='" + state + '\'' +
                ", industry='" + industry + '\'' +
                ", signalStrength=" + signalStrength +
                ", intentScore=" + intentScore +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Lead lead) {
        return new Builder()
                .id(lead.id)
                .type(lead.type)
                .name(lead.name)
                .email(lead.email)
                .phone(lead.phone)
                .company(lead.company)
                .website(lead.website)
                .address(lead.address)
                .city(lead.city)
                .state(lead.state)
                .country(lead.country)
                .postalCode(lead.postalCode)
                .latitude(lead.latitude)
                .longitude(lead.longitude)
                .industry(lead.industry)
                .companySize(lead.companySize)
                .revenueRange(lead.revenueRange)
                .employeeCount(lead.employeeCount)
                .leadCategory(lead.leadCategory)
                .source(lead.source)
                .signals(lead.signals)
                .signalStrength(lead.signalStrength)
                .intentScore(lead.intentScore)
                .needsIdentified(lead.needsIdentified)
                .status(lead.status)
                .profileId(lead.profileId)
                .createdAt(lead.createdAt)
                .updatedAt(lead.updatedAt);
    }

    public static class Builder {
        private String id;
        private LeadType type = LeadType.CONSUMER;
        private String name;
        private String email;
        private String phone;
        private String company;
        private String website;
        private String address;
        private String city;
        private String state;
        private String country;
        private String postalCode;
        private Double latitude;
        private Double longitude;
        private String industry;
        private String companySize;
        private String revenueRange;
        private Integer employeeCount;
        private String leadCategory;
        private String source;
        private List<Signal> signals = List.of();
        private int signalStrength;
        private int intentScore;
        private Set<String> needsIdentified = Set.of();
        private LeadStatus status;
        private String profileId;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(LeadType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder latitude(Double latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder longitude(Double longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder companySize(String companySize) {
            this.companySize = companySize;
            return this;
        }

        public Builder revenueRange(String revenueRange) {
            this.revenueRange = revenueRange;
            return this;
        }

        public Builder employeeCount(Integer employeeCount) {
            this.employeeCount = employeeCount;
            return this;
        }

        public Builder leadCategory(String leadCategory) {
            this.leadCategory = leadCategory;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder signals(List<Signal> signals) {
            this.signals = signals != null ? signals : List.of();
            return this;
        }

        public Builder signalStrength(int signalStrength) {
            this.signalStrength = signalStrength;
            return this;
        }

        public Builder intentScore(int intentScore) {
            this.intentScore = intentScore;
            return this;
        }

        public Builder needsIdentified(Set<String> needsIdentified) {
            this.needsIdentified = needsIdentified != null ? needsIdentified : Set.of();
            return this;
        }

        public Builder status(LeadStatus status) {
            this.status = status;
            return this;
        }

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Lead build() {
            Objects.requireNonNull(type, "type is required");
            if (signalStrength < 0 || signalStrength > 100) {
                throw new IllegalArgumentException("signalStrength must be in [0,100]");
            }
            if (intentScore < 0 || intentScore > 100) {
                throw new IllegalArgumentException("intentScore must be in [0,100]");
            }
            return new Lead(this);
        }
    }
}
