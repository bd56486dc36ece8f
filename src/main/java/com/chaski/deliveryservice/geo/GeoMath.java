package com.chaski.deliveryservice.geo;

/**
 * Spherical-earth distance helpers. All results are kilometers; nothing is rounded.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    // Below this length a route is treated as a single point
    static final double DEGENERATE_SEGMENT_KM = 0.1;

    private GeoMath() {}

    /**
     * Great-circle distance between two points using the haversine formula.
     */
    public static double haversineKm(GeoPoint a, GeoPoint b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLng = Math.toRadians(b.lng() - a.lng());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(a.lat())) * Math.cos(Math.toRadians(b.lat())) *
                        Math.sin(dLng / 2) * Math.sin(dLng / 2);

        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Minimum distance from {@code point} to the great-circle segment {@code start}-{@code end}.
     * When the perpendicular foot falls outside the segment the nearer endpoint is used.
     */
    public static double distanceToSegmentKm(GeoPoint point, GeoPoint start, GeoPoint end) {
        double startToPoint = haversineKm(start, point);
        double startToEnd = haversineKm(start, end);

        if (startToEnd < DEGENERATE_SEGMENT_KM) {
            return startToPoint;
        }

        double angle = initialBearing(start, point) - initialBearing(start, end);
        double angularStartToPoint = startToPoint / EARTH_RADIUS_KM;

        double crossTrack = Math.asin(clamp(Math.sin(angularStartToPoint) * Math.sin(angle)));
        double alongTrack = Math.acos(clamp(Math.cos(angularStartToPoint) / Math.cos(crossTrack)))
                * Math.signum(Math.cos(angle)) * EARTH_RADIUS_KM;

        if (alongTrack < 0) {
            return startToPoint;
        }
        if (alongTrack > startToEnd) {
            return haversineKm(end, point);
        }
        return Math.abs(crossTrack) * EARTH_RADIUS_KM;
    }

    /**
     * Extra distance of travelling start -> pickup -> dropoff -> end instead of start -> end.
     */
    public static double detourKm(GeoPoint start, GeoPoint end, GeoPoint pickup, GeoPoint dropoff) {
        double direct = haversineKm(start, end);
        double withPackage = haversineKm(start, pickup)
                + haversineKm(pickup, dropoff)
                + haversineKm(dropoff, end);
        return withPackage - direct;
    }

    private static double initialBearing(GeoPoint from, GeoPoint to) {
        double fromLat = Math.toRadians(from.lat());
        double toLat = Math.toRadians(to.lat());
        double dLng = Math.toRadians(to.lng() - from.lng());

        double y = Math.sin(dLng) * Math.cos(toLat);
        double x = Math.cos(fromLat) * Math.sin(toLat) - Math.sin(fromLat) * Math.cos(toLat) * Math.cos(dLng);
        return Math.atan2(y, x);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
