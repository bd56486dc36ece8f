package com.chaski.deliveryservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bidding window, deadline and route sweeps, and locking settings, bound from {@code chaski.bidding.*}.
 */
@Data
@ConfigurationProperties(prefix = "chaski.bidding")
public class BiddingProperties {

    /** Length of a fresh bidding window. */
    private Duration baseWindow = Duration.ofHours(24);

    /** How far an expired deadline is pushed out on each extension. */
    private Duration extensionWindow = Duration.ofHours(12);

    private int maxExtensions = 2;

    /** Lead time before the deadline at which the sender is warned. */
    private Duration warningLead = Duration.ofHours(6);

    private boolean sweepEnabled = true;

    private Duration sweepInterval = Duration.ofSeconds(60);

    private boolean routeSweepEnabled = true;

    /** How often routes past their trip date are expired. */
    private Duration routeSweepInterval = Duration.ofMinutes(15);

    /** Upper bound on waiting for in-flight sweep work during shutdown. */
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    private Duration lockTimeout = Duration.ofSeconds(3);

    private int busyRetryAttempts = 3;

    private Duration busyRetryBackoff = Duration.ofMillis(100);

    private Duration eligibilityTimeout = Duration.ofSeconds(2);
}
