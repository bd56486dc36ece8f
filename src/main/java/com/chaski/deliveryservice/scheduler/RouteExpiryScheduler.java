package com.chaski.deliveryservice.scheduler;

import com.chaski.deliveryservice.config.BiddingProperties;
import com.chaski.deliveryservice.entity.CourierRoute;
import com.chaski.deliveryservice.enums.BidStatus;
import com.chaski.deliveryservice.repository.RouteRepository;
import com.chaski.deliveryservice.service.BidLedgerService;
import com.chaski.deliveryservice.service.RouteService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep that deactivates routes whose trip day is over and withdraws the
 * PENDING bids placed from them. The same pass collects PENDING bids still attached
 * to inactive routes, which happens when a deactivation could not reach every package.
 */
@Slf4j
@Component
public class RouteExpiryScheduler {

    private final RouteRepository routeRepository;
    private final RouteService routeService;
    private final BidLedgerService bidLedger;
    private final BiddingProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService executor;

    public RouteExpiryScheduler(RouteRepository routeRepository,
                                RouteService routeService,
                                BidLedgerService bidLedger,
                                BiddingProperties properties,
                                Clock clock) {
        this.routeRepository = routeRepository;
        this.routeService = routeService;
        this.bidLedger = bidLedger;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!properties.isRouteSweepEnabled()) {
            log.info("Route expiry sweep disabled");
            return;
        }
        long intervalMs = properties.getRouteSweepInterval().toMillis();
        running.set(true);
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "route-expiry-sweep");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::runScheduledSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Route expiry sweep scheduled every {}ms", intervalMs);
    }

    @PreDestroy
    public void stop() {
        running.set(false);
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Route expiry sweep did not finish within {}, forcing shutdown", properties.getShutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public RouteSweepReport sweep() {
        LocalDate today = CourierRoute.tripDayOf(clock.instant());
        List<Long> routeIds = routeRepository.findActiveIdsWithTripDateBefore(today);

        int examined = 0;
        int expired = 0;
        int leftover = 0;
        int failed = 0;

        for (Long routeId : routeIds) {
            if (isStopping()) {
                log.info("Route sweep interrupted by shutdown after {} of {} routes", examined, routeIds.size());
                return new RouteSweepReport(examined, expired, leftover, failed);
            }
            examined++;
            try {
                if (routeService.expireIfPastTrip(routeId)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Could not expire route {}, will retry next sweep: {}", routeId, e.getMessage(), e);
            }
        }

        for (CourierRoute route : routeRepository.findInactiveWithBidsInStatus(BidStatus.PENDING)) {
            if (isStopping()) {
                break;
            }
            try {
                leftover += bidLedger.withdrawPendingBidsForRoute(route.getCourierId(), route.getId());
            } catch (RuntimeException e) {
                failed++;
                log.warn("Could not clean up bids on inactive route {}: {}", route.getId(), e.getMessage(), e);
            }
        }

        RouteSweepReport report = new RouteSweepReport(examined, expired, leftover, failed);
        if (!report.equals(RouteSweepReport.empty())) {
            log.info("Route sweep done: {}", report);
        }
        return report;
    }

    private void runScheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Route expiry sweep aborted: {}", e.getMessage(), e);
        }
    }

    private boolean isStopping() {
        return executor != null && !running.get();
    }
}
