package com.lead.discovery.lead;

import com.lead.discovery.geo.ParsedLocation;

import java.util.List;

/**
 * External source of business listings (maps, review sites, chambers of commerce).
 * Implementations may block on the network; the discovery service bounds each call
 * with a timeout.
 */
public interface BusinessDirectory {

    String name();

    /**
     * Listings near the location. Implementations may return a superset; the caller
     * applies the final location filter.
     */
    List<BusinessListing> findNear(ParsedLocation location, double radiusKm);

    List<BusinessListing> findByIndustry(String industry);

    default List<BusinessListing> findByKeywords(List<String> keywords) {
        return List.of();
    }
}
