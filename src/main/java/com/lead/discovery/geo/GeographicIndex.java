package com.lead.discovery.geo;

import com.lead.discovery.core.exception.ValidationException;
import com.lead.discovery.core.model.Locatable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Location filtering over leads and listings.
 *
 * <p>Radius search only applies real geometry when the centre is a coordinate pair.
 * For a postal code or a city/state string it degrades to exact text matching and the
 * radius is ignored. This is a known limitation of text-only locations.</p>
 */
public class GeographicIndex {
    private static final Logger log = LoggerFactory.getLogger(GeographicIndex.class);

    private final LocationParser parser;

    public GeographicIndex(LocationParser parser) {
        this.parser = parser;
    }

    public ParsedLocation parseLocation(String location) {
        return parser.parse(location);
    }

    public double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        return GeoDistance.haversine(lat1, lon1, lat2, lon2);
    }

    public <T extends Locatable> List<T> findInRadius(String location, double radiusKm, Collection<T> candidates) {
        return findInRadius(parser.parse(location), radiusKm, candidates);
    }

    /**
     * Candidates within {@code radiusKm} of a coordinate centre, nearest first; candidates
     * without coordinates are dropped. For a postal-code centre, candidates with that exact
     * postal code; for a text centre, candidates in that exact city (and state when given).
     */
    public <T extends Locatable> List<T> findInRadius(ParsedLocation center, double radiusKm, Collection<T> candidates) {
        if (radiusKm < 0) {
            throw new ValidationException("radiusKm must not be negative: " + radiusKm);
        }
        List<T> result = switch (center.kind()) {
            case COORDINATES -> candidates.stream()
                    .filter(Locatable::hasCoordinates)
                    .filter(c -> distanceFrom(center, c) <= radiusKm)
                    .sorted(Comparator.comparingDouble(c -> distanceFrom(center, c)))
                    .toList();
            case POSTAL_CODE -> candidates.stream()
                    .filter(c -> Objects.equals(center.postalCode(), c.getPostalCode()))
                    .toList();
            case TEXT -> candidates.stream()
                    .filter(c -> matchesText(center, c))
                    .toList();
        };
        log.debug("geo.radius kind={} radiusKm={} candidates={} matched={}",
                center.kind(), radiusKm, candidates.size(), result.size());
        return result;
    }

    /**
     * Exact city match, and the same state when the centre names one.
     */
    public boolean matchesText(ParsedLocation center, Locatable candidate) {
        if (candidate.getCity() == null || !candidate.getCity().trim().equalsIgnoreCase(center.city())) {
            return false;
        }
        return center.state() == null || StateAbbreviations.sameState(center.state(), candidate.getState());
    }

    private static double distanceFrom(ParsedLocation center, Locatable candidate) {
        return GeoDistance.haversine(center.latitude(), center.longitude(),
                candidate.getLatitude(), candidate.getLongitude());
    }
}
