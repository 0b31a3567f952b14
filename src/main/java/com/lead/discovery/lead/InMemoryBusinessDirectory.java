package com.lead.discovery.lead;

import com.lead.discovery.geo.GeographicIndex;
import com.lead.discovery.geo.LocationParser;
import com.lead.discovery.geo.ParsedLocation;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Directory over a fixed set of listings, for tests and locally imported data.
 */
public class InMemoryBusinessDirectory implements BusinessDirectory {

    private final String name;
    private final List<BusinessListing> listings = new CopyOnWriteArrayList<>();
    private final GeographicIndex geographicIndex = new GeographicIndex(new LocationParser());

    public InMemoryBusinessDirectory(String name, List<BusinessListing> listings) {
        this.name = name;
        this.listings.addAll(listings);
    }

    public void add(BusinessListing listing) {
        listings.add(listing);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<BusinessListing> findNear(ParsedLocation location, double radiusKm) {
        return geographicIndex.findInRadius(location, radiusKm, listings);
    }

    @Override
    public List<BusinessListing> findByIndustry(String industry) {
        String needle = industry.toLowerCase(Locale.ROOT);
        return listings.stream()
                .filter(l -> l.getIndustry() != null && l.getIndustry().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    @Override
    public List<BusinessListing> findByKeywords(List<String> keywords) {
        return listings.stream()
                .filter(l -> keywords.stream().anyMatch(k -> mentions(l, k)))
                .toList();
    }

    private static boolean mentions(BusinessListing listing, String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        return contains(listing.getBusinessName(), needle)
                || contains(listing.getBusinessType(), needle)
                || contains(listing.getIndustry(), needle);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
