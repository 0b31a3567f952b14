package com.lead.discovery.geo;

import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Lead;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeographicIndexTest {

    private final GeographicIndex index = new GeographicIndex(new LocationParser());

    private final Lead austin = Lead.builder().name("Austin Co").city("Austin").state("TX")
            .postalCode("78701").latitude(30.2672).longitude(-97.7431).build();
    private final Lead roundRock = Lead.builder().name("Round Rock Co").city("Round Rock").state("Texas")
            .postalCode("78664").latitude(30.5083).longitude(-97.6789).build();
    private final Lead houston = Lead.builder().name("Houston Co").city("Houston").state("TX")
            .latitude(29.7604).longitude(-95.3698).build();
    private final Lead austinNoCoordinates = Lead.builder().name("Austin MN").city("Austin").state("MN").build();

    private final List<Lead> candidates = List.of(houston, roundRock, austin, austinNoCoordinates);

    @Test
    void distanceIsZeroForSamePoint() {
        assertEquals(0.0, GeoDistance.haversine(30.2672, -97.7431, 30.2672, -97.7431), 1e-9);
    }

    @Test
    void quarterMeridian() {
        assertEquals(10007.5, index.distanceKm(0, 0, 0, 90), 0.1);
    }

    @Test
    void distanceIsSymmetric() {
        assertEquals(GeoDistance.haversine(30.2672, -97.7431, 29.7604, -95.3698),
                GeoDistance.haversine(29.7604, -95.3698, 30.2672, -97.7431), 1e-9);
    }

    @Test
    @DisplayName("Coordinate centre filters by distance, nearest first")
    void coordinateRadius() {
        List<Lead> within = index.findInRadius("30.2672,-97.7431", 50, candidates);
        assertEquals(List.of(austin, roundRock), within);

        assertEquals(3, index.findInRadius("30.2672,-97.7431", 300, candidates).size());
    }

    @Test
    @DisplayName("Postal code centre matches the exact code and ignores the radius")
    void postalCodeMatch() {
        assertEquals(List.of(roundRock), index.findInRadius("78664", 1000, candidates));
    }

    @Test
    @DisplayName("Text centre matches exact city and state, abbreviations included")
    void textFallback() {
        assertEquals(List.of(austin), index.findInRadius("Austin, Texas", 50, candidates));
        assertEquals(List.of(austin, austinNoCoordinates), index.findInRadius("austin", 50, candidates));
        assertEquals(List.of(roundRock), index.findInRadius("Round Rock, TX", 0, candidates));
    }

    @Test
    void negativeRadius_rejected() {
        assertThrows(ValidationException.class, () -> index.findInRadius("Austin, TX", -1, candidates));
    }

    @Test
    void stateAbbreviations() {
        assertEquals("TX", StateAbbreviations.abbreviationOf("texas").orElseThrow());
        assertEquals("new york", StateAbbreviations.nameOf("NY").orElseThrow());
        assertTrue(StateAbbreviations.sameState("ca", "California"));
        assertFalse(StateAbbreviations.sameState("TX", "MN"));
        assertTrue(StateAbbreviations.sameState("Ontario", "ontario"));
    }
}
