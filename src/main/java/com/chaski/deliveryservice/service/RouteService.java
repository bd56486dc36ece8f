package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.dto.CreateRouteRequest;
import com.chaski.deliveryservice.entity.CourierRoute;
import com.chaski.deliveryservice.exception.NotFoundException;
import com.chaski.deliveryservice.exception.NotOwnerException;
import com.chaski.deliveryservice.repository.RouteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Courier routes. A courier has at most one active route: activating a new one
 * deactivates the others under the courier lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteService {

    static final double DEFAULT_MAX_DEVIATION_KM = 5.0;

    private final RouteRepository routeRepository;
    private final PackageLockManager lockManager;
    private final BidLedgerService bidLedger;
    private final Clock clock;

    public CourierRoute createRoute(Long courierId, CreateRouteRequest request) {
        List<Long> replaced = new ArrayList<>();

        CourierRoute created = lockManager.withCourierLock(courierId, () -> {
            for (CourierRoute previous : routeRepository.findByCourierIdAndActiveTrue(courierId)) {
                previous.setActive(false);
                routeRepository.save(previous);
                replaced.add(previous.getId());
            }

            CourierRoute route = CourierRoute.builder()
                    .courierId(courierId)
                    .startAddress(request.startAddress())
                    .startLat(request.startLat())
                    .startLng(request.startLng())
                    .endAddress(request.endAddress())
                    .endLat(request.endLat())
                    .endLng(request.endLng())
                    .maxDeviationKm(request.maxDeviationKm() != null ? request.maxDeviationKm() : DEFAULT_MAX_DEVIATION_KM)
                    .tripDate(request.tripDate())
                    .active(true)
                    .createdAt(clock.instant())
                    .build();
            return routeRepository.save(route);
        });

        log.info("Courier {} activated route {} (replaced {})", courierId, created.getId(), replaced);
        // Bid clean-up takes package locks, so it runs after the courier lock is released
        replaced.forEach(routeId -> bidLedger.withdrawPendingBidsForRoute(courierId, routeId));
        return created;
    }

    public CourierRoute deactivateRoute(Long routeId, Long courierId) {
        CourierRoute route = lockManager.withCourierLock(courierId, () -> {
            CourierRoute current = getRoute(routeId);
            if (!current.getCourierId().equals(courierId)) {
                throw new NotOwnerException("Route " + routeId + " belongs to another courier");
            }
            if (current.isActive()) {
                current.setActive(false);
                routeRepository.save(current);
                log.info("Courier {} deactivated route {}", courierId, routeId);
            }
            return current;
        });

        bidLedger.withdrawPendingBidsForRoute(courierId, routeId);
        return route;
    }

    /**
     * Takes a route off the market once its trip day is over and withdraws the bids
     * placed from it. Does nothing for a route that is already inactive or still current.
     *
     * @return true when this call deactivated the route
     */
    public boolean expireIfPastTrip(Long routeId) {
        Long courierId = getRoute(routeId).getCourierId();
        boolean expired = lockManager.withCourierLock(courierId, () -> {
            CourierRoute current = getRoute(routeId);
            if (!current.isActive() || !current.isPastTrip(clock.instant())) {
                return false;
            }
            current.setActive(false);
            routeRepository.save(current);
            log.info("Route {} of courier {} expired (trip date {})", routeId, courierId, current.getTripDate());
            return true;
        });

        if (expired) {
            bidLedger.withdrawPendingBidsForRoute(courierId, routeId);
        }
        return expired;
    }

    public CourierRoute getRoute(Long routeId) {
        return routeRepository.findById(routeId)
                .orElseThrow(() -> new NotFoundException("Route", routeId));
    }

    public Optional<CourierRoute> getActiveRoute(Long courierId) {
        return routeRepository.findByCourierIdAndActiveTrue(courierId).stream().findFirst();
    }
}
