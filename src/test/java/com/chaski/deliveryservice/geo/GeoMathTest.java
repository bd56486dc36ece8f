package com.chaski.deliveryservice.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoMathTest {

    // One degree of longitude along the equator
    private static final double ONE_DEGREE_KM = GeoMath.EARTH_RADIUS_KM * Math.PI / 180;

    private static final GeoPoint START = new GeoPoint(0, 0);
    private static final GeoPoint END = new GeoPoint(0, 1);

    @Test
    void haversine_OneDegreeOnEquator() {
        assertEquals(ONE_DEGREE_KM, GeoMath.haversineKm(START, END), 1e-6);
        assertEquals(111.195, GeoMath.haversineKm(START, END), 0.001);
    }

    @Test
    void haversine_SamePointIsZero() {
        GeoPoint lima = new GeoPoint(-12.0464, -77.0428);
        assertEquals(0.0, GeoMath.haversineKm(lima, lima), 1e-9);
    }

    @Test
    void haversine_IsSymmetric() {
        GeoPoint lima = new GeoPoint(-12.0464, -77.0428);
        GeoPoint cusco = new GeoPoint(-13.5319, -71.9675);
        assertEquals(GeoMath.haversineKm(lima, cusco), GeoMath.haversineKm(cusco, lima), 1e-9);
    }

    @Test
    void distanceToSegment_PerpendicularFootInsideSegment() {
        // 8 km north of the middle of the route
        GeoPoint point = new GeoPoint(8 / ONE_DEGREE_KM, 0.5);

        assertEquals(8.0, GeoMath.distanceToSegmentKm(point, START, END), 0.01);
    }

    @Test
    void distanceToSegment_PointOnSegmentIsZero() {
        assertEquals(0.0, GeoMath.distanceToSegmentKm(new GeoPoint(0, 0.25), START, END), 1e-6);
    }

    @Test
    void distanceToSegment_BeyondEndUsesEndpoint() {
        GeoPoint point = new GeoPoint(0, 1.5);

        assertEquals(GeoMath.haversineKm(END, point), GeoMath.distanceToSegmentKm(point, START, END), 1e-6);
    }

    @Test
    void distanceToSegment_BeforeStartUsesStartpoint() {
        GeoPoint point = new GeoPoint(0.1, -0.5);

        assertEquals(GeoMath.haversineKm(START, point), GeoMath.distanceToSegmentKm(point, START, END), 1e-6);
    }

    @Test
    void distanceToSegment_DegenerateSegmentUsesStart() {
        GeoPoint start = new GeoPoint(10, 10);
        GeoPoint almostSame = new GeoPoint(10, 10.0005);
        GeoPoint point = new GeoPoint(10.2, 10);

        assertEquals(GeoMath.haversineKm(start, point), GeoMath.distanceToSegmentKm(point, start, almostSame), 1e-9);
    }

    @Test
    void detour_PackageAlongRouteIsZero() {
        double detour = GeoMath.detourKm(START, END, new GeoPoint(0, 0.2), new GeoPoint(0, 0.8));

        assertEquals(0.0, detour, 1e-6);
    }

    @Test
    void detour_OffRoutePackageAddsDistance() {
        GeoPoint pickup = new GeoPoint(0.03, 0.3);
        GeoPoint dropoff = new GeoPoint(0.03, 0.7);

        double expected = GeoMath.haversineKm(START, pickup) + GeoMath.haversineKm(pickup, dropoff)
                + GeoMath.haversineKm(dropoff, END) - GeoMath.haversineKm(START, END);
        double detour = GeoMath.detourKm(START, END, pickup, dropoff);

        assertEquals(expected, detour, 1e-9);
        assertTrue(detour > 0, "Leaving the route should cost distance");
    }

    @Test
    void detour_BackwardsPackageCostsMoreThanForwards() {
        double forwards = GeoMath.detourKm(START, END, new GeoPoint(0, 0.2), new GeoPoint(0, 0.8));
        double backwards = GeoMath.detourKm(START, END, new GeoPoint(0, 0.8), new GeoPoint(0, 0.2));

        assertTrue(backwards > forwards + 100, "Carrying a package against the route doubles back");
    }

    @Test
    void geoPoint_RejectsOutOfRangeCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> new GeoPoint(91, 0));
        assertThrows(IllegalArgumentException.class, () -> new GeoPoint(0, -181));
    }
}
