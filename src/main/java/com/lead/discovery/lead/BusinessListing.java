package com.lead.discovery.lead;

import com.lead.discovery.core.model.Locatable;

import java.util.Objects;

/**
 * A business found in an external directory, before it becomes a lead.
 */
public class BusinessListing implements Locatable {
    private final String businessName;
    private final String businessType;
    private final String industry;
    private final String address;
    private final String city;
    private final String state;
    private final String country;
    private final String postalCode;
    private final Double latitude;
    private final Double longitude;
    private final String phone;
    private final String email;
    private final String website;
    private final String source;

    private BusinessListing(Builder builder) {
        this.businessName = builder.businessName;
        this.businessType = builder.businessType;
        this.industry = builder.industry;
        this.address = builder.address;
        this.city = builder.city;
        this.state = builder.state;
        this.country = builder.country;
        this.postalCode = builder.postalCode;
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.phone = builder.phone;
        this.email = builder.email;
        this.website = builder.website;
        this.source = builder.source;
    }

    public String getBusinessName() {
        return businessName;
    }

    public String getBusinessType() {
        return businessType;
    }

    public String getIndustry() {
        return industry;
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

    public String getPhone() {
        return phone;
    }

    public String getEmail() {
        return email;
    }

    public String getWebsite() {
        return website;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "BusinessListing{" +
                "businessName='" + businessName + '\'' +
                ", industry='" + industry + '\'' +
                ", city='" + city + '\'' +
                ", state='" + state + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String businessName;
        private String businessType;
        private String industry;
        private String address;
        private String city;
        private String state;
        private String country = "US";
        private String postalCode;
        private Double latitude;
        private Double longitude;
        private String phone;
        private String email;
        private String website;
        private String source = "local_directory";

        public Builder businessName(String businessName) {
            this.businessName = businessName;
            return this;
        }

        public Builder businessType(String businessType) {
            this.businessType = businessType;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
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

        public Builder coordinates(Double latitude, Double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public BusinessListing build() {
            Objects.requireNonNull(businessName, "businessName is required");
            return new BusinessListing(this);
        }
    }
}
