package com.lead.discovery.core.model;

/**
 * Anything placed on the map: leads and directory listings.
 */
public interface Locatable {

    String getCity();

    String getState();

    String getCountry();

    String getPostalCode();

    Double getLatitude();

    Double getLongitude();

    default boolean hasCoordinates() {
        return getLatitude() != null && getLongitude() != null;
    }
}
