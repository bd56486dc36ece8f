package com.chaski.deliveryservice.geo;

/**
 * Distance model used by route matching. The default bean measures straight
 * great-circle lines; a road-network model can replace it without touching the
 * match engine.
 */
public interface RouteGeometry {

    /**
     * Stable id for logs and diagnostics.
     */
    String id();

    /**
     * Shortest distance from a point to the route between {@code start} and {@code end}.
     */
    double distanceFromRouteKm(GeoPoint point, GeoPoint start, GeoPoint end);

    /**
     * Added travel when a pickup and a dropoff are inserted into the route.
     */
    double detourKm(GeoPoint start, GeoPoint end, GeoPoint pickup, GeoPoint dropoff);
}
