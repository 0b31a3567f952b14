package com.lead.discovery.api;

import com.lead.discovery.cache.CacheConfig;
import com.lead.discovery.matching.MatchingWeights;
import com.lead.discovery.privacy.PrivacyPolicy;
import com.lead.discovery.retention.RetentionPolicy;

/**
 * Options for a {@link LeadDiscoveryEngine}.
 * Configures matching weights, alert threshold, discovery concurrency and caching.
 */
public class EngineOptions {

    private static final double DEFAULT_ALERT_THRESHOLD = 75.0;
    private static final int DEFAULT_TOP_N = 5;
    private static final int DEFAULT_MAX_CONCURRENCY = 4;
    private static final long DEFAULT_DISCOVERY_TIMEOUT_MS = 10_000;
    private static final int DEFAULT_MIN_SHARED_IDENTIFIERS = 2;
    private static final String DEFAULT_COUNTRY = "US";

    private final MatchingWeights matchingWeights;
    private final double alertThreshold;
    private final int topN;
    private final int maxConcurrency;
    private final long discoveryTimeoutMs;
    private final int minSharedIdentifiers;
    private final String defaultCountry;
    private final CacheConfig catalogCache;
    private final PrivacyPolicy privacyPolicy;
    private final RetentionPolicy retentionPolicy;

    private EngineOptions(Builder builder) {
        this.matchingWeights = builder.matchingWeights;
        this.alertThreshold = builder.alertThreshold;
        this.topN = builder.topN;
        this.maxConcurrency = builder.maxConcurrency;
        this.discoveryTimeoutMs = builder.discoveryTimeoutMs;
        this.minSharedIdentifiers = builder.minSharedIdentifiers;
        this.defaultCountry = builder.defaultCountry;
        this.catalogCache = builder.catalogCache;
        this.privacyPolicy = builder.privacyPolicy;
        this.retentionPolicy = builder.retentionPolicy;
    }

    public MatchingWeights getMatchingWeights() {
        return matchingWeights;
    }

    public double getAlertThreshold() {
        return alertThreshold;
    }

    public int getTopN() {
        return topN;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public long getDiscoveryTimeoutMs() {
        return discoveryTimeoutMs;
    }

    public int getMinSharedIdentifiers() {
        return minSharedIdentifiers;
    }

    public String getDefaultCountry() {
        return defaultCountry;
    }

    public CacheConfig getCatalogCache() {
        return catalogCache;
    }

    public PrivacyPolicy getPrivacyPolicy() {
        return privacyPolicy;
    }

    public RetentionPolicy getRetentionPolicy() {
        return retentionPolicy;
    }

    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingWeights matchingWeights = MatchingWeights.defaultWeights();
        private double alertThreshold = DEFAULT_ALERT_THRESHOLD;
        private int topN = DEFAULT_TOP_N;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private long discoveryTimeoutMs = DEFAULT_DISCOVERY_TIMEOUT_MS;
        private int minSharedIdentifiers = DEFAULT_MIN_SHARED_IDENTIFIERS;
        private String defaultCountry = DEFAULT_COUNTRY;
        private CacheConfig catalogCache = CacheConfig.defaults();
        private PrivacyPolicy privacyPolicy = PrivacyPolicy.defaults();
        private RetentionPolicy retentionPolicy = RetentionPolicy.defaults();

        public Builder matchingWeights(MatchingWeights weights) {
            this.matchingWeights = weights;
            return this;
        }

        public Builder alertThreshold(double threshold) {
            this.alertThreshold = threshold;
            return this;
        }

        /**
         * Number of matches persisted per lead by a matching run.
         */
        public Builder topN(int topN) {
            this.topN = topN;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder discoveryTimeoutMs(long timeoutMs) {
            this.discoveryTimeoutMs = timeoutMs;
            return this;
        }

        public Builder minSharedIdentifiers(int minSharedIdentifiers) {
            this.minSharedIdentifiers = minSharedIdentifiers;
            return this;
        }

        public Builder defaultCountry(String defaultCountry) {
            this.defaultCountry = defaultCountry;
            return this;
        }

        public Builder catalogCache(CacheConfig catalogCache) {
            this.catalogCache = catalogCache;
            return this;
        }

        public Builder privacyPolicy(PrivacyPolicy privacyPolicy) {
            this.privacyPolicy = privacyPolicy;
            return this;
        }

        public Builder retentionPolicy(RetentionPolicy retentionPolicy) {
            this.retentionPolicy = retentionPolicy;
            return this;
        }

        public EngineOptions build() {
            if (matchingWeights == null) {
                throw new IllegalArgumentException("matchingWeights is required");
            }
            if (alertThreshold < 0 || alertThreshold > 100) {
                throw new IllegalArgumentException("alertThreshold must be between 0 and 100");
            }
            if (topN <= 0) {
                throw new IllegalArgumentException("topN must be > 0");
            }
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be > 0");
            }
            if (discoveryTimeoutMs <= 0) {
                throw new IllegalArgumentException("discoveryTimeoutMs must be > 0");
            }
            if (minSharedIdentifiers <= 0) {
                throw new IllegalArgumentException("minSharedIdentifiers must be > 0");
            }
            if (catalogCache == null || privacyPolicy == null || retentionPolicy == null) {
                throw new IllegalArgumentException("catalogCache, privacyPolicy and retentionPolicy are required");
            }
            return new EngineOptions(this);
        }
    }
}
