package com.chaski.deliveryservice.geo;

/**
 * A WGS84 coordinate in decimal degrees.
 */
public record GeoPoint(double lat, double lng) {

    public GeoPoint {
        if (lat < -90 || lat > 90) {
            throw new IllegalArgumentException("Latitude out of range: " + lat);
        }
        if (lng < -180 || lng > 180) {
            throw new IllegalArgumentException("Longitude out of range: " + lng);
        }
    }
}
