package com.chaski.deliveryservice.scheduler;

/**
 * Counters for one route expiry sweep. {@code leftoverBidsWithdrawn} counts PENDING
 * bids collected from routes that were already inactive.
 */
public record RouteSweepReport(int examined, int expired, int leftoverBidsWithdrawn, int failed) {

    public static RouteSweepReport empty() {
        return new RouteSweepReport(0, 0, 0, 0);
    }
}
