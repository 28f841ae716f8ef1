package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.models.GeoPoint;
import com.locationinsights.backend.models.Place;
import com.locationinsights.backend.util.GeoMath;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RadiusFilterTest {

    private static final GeoPoint CENTER = GeoPoint.of(40.0, -74.0);

    private final RadiusFilter radiusFilter = new RadiusFilter();

    @Test
    void testKeepsInsideDropsOutside() {
        // Given
        Place inside = place("in", GeoMath.destination(CENTER, 45.0, GeoMath.milesToMeters(4.0)));
        Place outside = place("out", GeoMath.destination(CENTER, 45.0, GeoMath.milesToMeters(6.0)));

        // When
        List<Place> kept = radiusFilter.filter(List.of(inside, outside), CENTER, 5.0);

        // Then
        assertEquals(1, kept.size());
        assertEquals("in", kept.get(0).getPlaceId());
        assertEquals(4.0, kept.get(0).getDistanceMiles(), 1e-6);
    }

    @Test
    void testBoundaryIsInclusive() {
        Place atCenter = place("c", CENTER);

        List<Place> kept = radiusFilter.filter(List.of(atCenter), CENTER, 1e-9);

        assertEquals(1, kept.size());
        assertEquals(0.0, kept.get(0).getDistanceMiles());
    }

    @Test
    void testNoPlaceWithoutCoordinateOrBeyondRadiusSurvives() {
        Random random = new Random(42);
        List<Place> places = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            double meters = GeoMath.milesToMeters(random.nextDouble() * 20.0);
            places.add(place("p" + i, GeoMath.destination(CENTER, random.nextDouble() * 360.0, meters)));
        }
        places.add(place("nowhere", null));

        List<Place> kept = radiusFilter.filter(places, CENTER, 10.0);

        assertFalse(kept.isEmpty());
        for (Place p : kept) {
            assertNotNull(p.getLocation());
            assertTrue(GeoMath.haversineMiles(CENTER, p.getLocation()) <= 10.0);
        }
    }

    private static Place place(String id, GeoPoint location) {
        return Place.builder()
                .placeId(id)
                .name(id)
                .location(location)
                .distanceMiles(-1.0)
                .build();
    }
}
