package com.chaski.deliveryservice.scheduler;

/**
 * Counters for one deadline sweep.
 */
public record SweepReport(int examined, int warned, int extended, int purged, int failed) {

    public static SweepReport empty() {
        return new SweepReport(0, 0, 0, 0, 0);
    }
}
