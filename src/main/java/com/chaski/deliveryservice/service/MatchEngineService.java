package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.dto.MatchResult;
import com.chaski.deliveryservice.entity.CourierRoute;
import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.exception.NotFoundException;
import com.chaski.deliveryservice.geo.GeoPoint;
import com.chaski.deliveryservice.geo.RouteGeometry;
import com.chaski.deliveryservice.repository.PackageRepository;
import com.chaski.deliveryservice.repository.RouteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks biddable packages against a courier route. Read-only and lock-free; results are
 * recomputed from live package state on every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchEngineService {

    /**
     * Smallest detour first, then closest to the route, then oldest package. The id
     * makes the order total.
     */
    static final Comparator<MatchResult> RANKING = Comparator
            .comparingDouble(MatchResult::estimatedDetourKm)
            .thenComparingDouble(MatchResult::distanceFromRouteKm)
            .thenComparing(MatchResult::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(MatchResult::packageId);

    private final RouteRepository routeRepository;
    private final PackageRepository packageRepository;
    private final RouteGeometry routeGeometry;
    private final Clock clock;

    public List<MatchResult> findMatches(Long routeId) {
        CourierRoute route = routeRepository.findById(routeId)
                .orElseThrow(() -> new NotFoundException("Route", routeId));
        return findMatches(route);
    }

    public List<MatchResult> findMatches(CourierRoute route) {
        Instant now = clock.instant();
        if (!route.isUsable(now)) {
            return List.of();
        }

        GeoPoint start = new GeoPoint(route.getStartLat(), route.getStartLng());
        GeoPoint end = new GeoPoint(route.getEndLat(), route.getEndLng());
        double maxDeviationKm = route.getMaxDeviationKm();

        List<DeliveryPackage> candidates = packageRepository.findByStatus(PackageStatus.OPEN_FOR_BIDS);
        List<MatchResult> matches = candidates.stream()
                .filter(pkg -> pkg.getBiddingDeadline() == null || now.isBefore(pkg.getBiddingDeadline()))
                .filter(pkg -> !pkg.getSenderId().equals(route.getCourierId()))
                .map(pkg -> evaluate(pkg, start, end, maxDeviationKm))
                .flatMap(Optional::stream)
                .sorted(RANKING)
                .toList();

        log.debug("Route {} ({}): {} of {} open packages within {} km",
                route.getId(), routeGeometry.id(), matches.size(), candidates.size(), maxDeviationKm);
        return matches;
    }

    private Optional<MatchResult> evaluate(DeliveryPackage pkg, GeoPoint start, GeoPoint end, double maxDeviationKm) {
        GeoPoint pickup = new GeoPoint(pkg.getPickupLat(), pkg.getPickupLng());
        GeoPoint dropoff = new GeoPoint(pkg.getDropoffLat(), pkg.getDropoffLng());

        double pickupDistance = routeGeometry.distanceFromRouteKm(pickup, start, end);
        if (pickupDistance > maxDeviationKm) {
            return Optional.empty();
        }
        double dropoffDistance = routeGeometry.distanceFromRouteKm(dropoff, start, end);
        if (dropoffDistance > maxDeviationKm) {
            return Optional.empty();
        }
        double detour = routeGeometry.detourKm(start, end, pickup, dropoff);
        if (detour > maxDeviationKm) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(pkg, pickupDistance, detour));
    }
}
