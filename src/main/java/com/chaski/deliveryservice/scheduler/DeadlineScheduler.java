package com.chaski.deliveryservice.scheduler;

import com.chaski.deliveryservice.config.BiddingProperties;
import com.chaski.deliveryservice.enums.DeadlineAction;
import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.repository.PackageRepository;
import com.chaski.deliveryservice.service.PackageLifecycleService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep over open bidding windows.
 * <p>
 * Each package is handed to {@link PackageLifecycleService#applyDeadlinePolicy(Long)}
 * as its own unit of work. A failure on one package is logged and picked up again
 * on the next tick; it never stops the rest of the sweep.
 */
@Slf4j
@Component
public class DeadlineScheduler {

    private final PackageRepository packageRepository;
    private final PackageLifecycleService packageLifecycle;
    private final BiddingProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService executor;

    public DeadlineScheduler(PackageRepository packageRepository,
                             PackageLifecycleService packageLifecycle,
                             BiddingProperties properties,
                             Clock clock) {
        this.packageRepository = packageRepository;
        this.packageLifecycle = packageLifecycle;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!properties.isSweepEnabled()) {
            log.info("Deadline sweep disabled");
            return;
        }
        long intervalMs = properties.getSweepInterval().toMillis();
        running.set(true);
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "deadline-sweep");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::runScheduledSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Deadline sweep scheduled every {}ms", intervalMs);
    }

    @PreDestroy
    public void stop() {
        running.set(false);
        if (executor == null) {
            return;
        }
        log.info("Stopping deadline sweep");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Deadline sweep did not finish within {}, forcing shutdown", properties.getShutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs one pass over every OPEN_FOR_BIDS package whose deadline falls within the
     * warning lead. Safe to call concurrently with user actions and with itself.
     */
    public SweepReport sweep() {
        Instant cutoff = clock.instant().plus(properties.getWarningLead());
        List<Long> packageIds = packageRepository.findIdsWithDeadlineBefore(PackageStatus.OPEN_FOR_BIDS, cutoff);
        if (packageIds.isEmpty()) {
            return SweepReport.empty();
        }

        int examined = 0;
        int warned = 0;
        int extended = 0;
        int purged = 0;
        int failed = 0;

        for (Long packageId : packageIds) {
            if (isStopping()) {
                log.info("Sweep interrupted by shutdown after {} of {} packages", examined, packageIds.size());
                break;
            }
            examined++;
            try {
                DeadlineAction action = packageLifecycle.applyDeadlinePolicy(packageId);
                switch (action) {
                    case WARNED -> warned++;
                    case EXTENDED -> extended++;
                    case PURGED -> purged++;
                    case NONE -> { }
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Deadline policy failed for package {}, will retry next sweep: {}", packageId, e.getMessage(), e);
            }
        }

        SweepReport report = new SweepReport(examined, warned, extended, purged, failed);
        log.info("Deadline sweep done: {}", report);
        return report;
    }

    private void runScheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task
            log.error("Deadline sweep aborted: {}", e.getMessage(), e);
        }
    }

    private boolean isStopping() {
        return executor != null && !running.get();
    }
}
