package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.models.GeoPoint;
import com.locationinsights.backend.models.Place;
import com.locationinsights.backend.util.GeoMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps places whose great-circle distance to the center is at most the radius (inclusive).
 * Distances on the returned places are recomputed here.
 */
@Component
@Slf4j
public class RadiusFilter {

    public List<Place> filter(List<Place> places, GeoPoint center, double radiusMiles) {
        List<Place> kept = new ArrayList<>(places.size());
        for (Place place : places) {
            if (place.getLocation() == null) {
                continue;
            }
            double distance = GeoMath.haversineMiles(center, place.getLocation());
            if (distance <= radiusMiles) {
                kept.add(place.withDistanceMiles(distance));
            }
        }
        log.info("Radius filter kept {} of {} places within {} mi", kept.size(), places.size(), radiusMiles);
        return kept;
    }
}
