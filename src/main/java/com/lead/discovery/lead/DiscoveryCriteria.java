package com.lead.discovery.lead;

import java.util.List;

/**
 * What a discovery run looks for. At least one of area, industry or keywords should be set;
 * an empty criteria discovers nothing.
 */
public class DiscoveryCriteria {
    public static final double DEFAULT_RADIUS_KM = 50.0;

    private final String geographicArea;
    private final double radiusKm;
    private final String industry;
    private final List<String> keywords;
    private final String leadCategory;

    private DiscoveryCriteria(Builder builder) {
        this.geographicArea = builder.geographicArea;
        this.radiusKm = builder.radiusKm;
        this.industry = builder.industry;
        this.keywords = List.copyOf(builder.keywords);
        this.leadCategory = builder.leadCategory;
    }

    public String getGeographicArea() {
        return geographicArea;
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public String getIndustry() {
        return industry;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public String getLeadCategory() {
        return leadCategory;
    }

    public boolean hasGeographicArea() {
        return geographicArea != null && !geographicArea.isBlank();
    }

    public boolean hasIndustry() {
        return industry != null && !industry.isBlank();
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String geographicArea;
        private double radiusKm = DEFAULT_RADIUS_KM;
        private String industry;
        private List<String> keywords = List.of();
        private String leadCategory;

        public Builder geographicArea(String geographicArea) {
            this.geographicArea = geographicArea;
            return this;
        }

        public Builder radiusKm(double radiusKm) {
            this.radiusKm = radiusKm;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords != null ? keywords : List.of();
            return this;
        }

        public Builder leadCategory(String leadCategory) {
            this.leadCategory = leadCategory;
            return this;
        }

        public DiscoveryCriteria build() {
            if (radiusKm < 0) {
                throw new IllegalArgumentException("radiusKm must be >= 0");
            }
            return new DiscoveryCriteria(this);
        }
    }
}
