package com.chaski.deliveryservice.geo;

import org.springframework.stereotype.Component;

@Component
public class GreatCircleRouteGeometry implements RouteGeometry {

    @Override
    public String id() {
        return "great-circle";
    }

    @Override
    public double distanceFromRouteKm(GeoPoint point, GeoPoint start, GeoPoint end) {
        return GeoMath.distanceToSegmentKm(point, start, end);
    }

    @Override
    public double detourKm(GeoPoint start, GeoPoint end, GeoPoint pickup, GeoPoint dropoff) {
        return GeoMath.detourKm(start, end, pickup, dropoff);
    }
}
