package com.locationinsights.backend.util;

import com.locationinsights.backend.models.GeoPoint;

/**
 * Spherical-earth helpers. All distances are great-circle distances on a sphere of radius 6,371 km.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;
    public static final double METERS_PER_MILE = 1609.344;

    private GeoMath() {
    }

    public static double milesToMeters(double miles) {
        return miles * METERS_PER_MILE;
    }

    public static double metersToMiles(double meters) {
        return meters / METERS_PER_MILE;
    }

    /**
     * Haversine distance in meters.
     */
    public static double haversineMeters(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.latitude());
        double phi2 = Math.toRadians(b.latitude());
        double dPhi = Math.toRadians(b.latitude() - a.latitude());
        double dLambda = Math.toRadians(b.longitude() - a.longitude());

        double h = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);

        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    public static double haversineMiles(GeoPoint a, GeoPoint b) {
        return metersToMiles(haversineMeters(a, b));
    }

    /**
     * Point reached by travelling {@code distanceMeters} from {@code origin} along the great circle
     * with initial {@code bearingDegrees} (clockwise from north).
     */
    public static GeoPoint destination(GeoPoint origin, double bearingDegrees, double distanceMeters) {
        double delta = distanceMeters / EARTH_RADIUS_METERS;
        double theta = Math.toRadians(bearingDegrees);
        double phi1 = Math.toRadians(origin.latitude());
        double lambda1 = Math.toRadians(origin.longitude());

        double sinPhi2 = Math.sin(phi1) * Math.cos(delta) + Math.cos(phi1) * Math.sin(delta) * Math.cos(theta);
        double phi2 = Math.asin(Math.max(-1.0, Math.min(1.0, sinPhi2)));
        double lambda2 = lambda1 + Math.atan2(
                Math.sin(theta) * Math.sin(delta) * Math.cos(phi1),
                Math.cos(delta) - Math.sin(phi1) * Math.sin(phi2));

        return GeoPoint.of(Math.toDegrees(phi2), normalizeLongitude(Math.toDegrees(lambda2)));
    }

    /**
     * Inverse of an azimuthal equidistant projection centered on {@code origin}:
     * the plane offset (east, north) in meters maps to a point whose distance from origin
     * is exactly the offset length.
     */
    public static GeoPoint fromLocalOffset(GeoPoint origin, double eastMeters, double northMeters) {
        double distance = Math.hypot(eastMeters, northMeters);
        if (distance == 0.0) {
            return origin;
        }
        double bearing = Math.toDegrees(Math.atan2(eastMeters, northMeters));
        return destination(origin, bearing, distance);
    }

    static double normalizeLongitude(double longitude) {
        double lon = ((longitude + 540.0) % 360.0) - 180.0;
        return lon == -180.0 && longitude > 0 ? 180.0 : lon;
    }
}
