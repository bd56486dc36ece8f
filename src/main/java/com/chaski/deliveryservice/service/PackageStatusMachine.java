package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.exception.InvalidTransitionException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.chaski.deliveryservice.enums.PackageStatus.*;

/**
 * Allowed package status transitions.
 *
 * <pre>
 * NEW -> OPEN_FOR_BIDS -> BID_SELECTED -> PENDING_PICKUP -> IN_TRANSIT -> DELIVERED
 *        ↺ (extend / purge)
 * CANCELED from NEW, OPEN_FOR_BIDS, BID_SELECTED, PENDING_PICKUP
 * FAILED   from PENDING_PICKUP, IN_TRANSIT
 * </pre>
 *
 * DELIVERED, CANCELED and FAILED are terminal.
 */
@Slf4j
public final class PackageStatusMachine {

    private static final Map<PackageStatus, Set<PackageStatus>> ALLOWED = new EnumMap<>(PackageStatus.class);

    static {
        ALLOWED.put(NEW, EnumSet.of(OPEN_FOR_BIDS, CANCELED));
        ALLOWED.put(OPEN_FOR_BIDS, EnumSet.of(OPEN_FOR_BIDS, BID_SELECTED, CANCELED));
        ALLOWED.put(BID_SELECTED, EnumSet.of(PENDING_PICKUP, CANCELED));
        ALLOWED.put(PENDING_PICKUP, EnumSet.of(IN_TRANSIT, CANCELED, FAILED));
        ALLOWED.put(IN_TRANSIT, EnumSet.of(DELIVERED, FAILED));
        ALLOWED.put(DELIVERED, EnumSet.noneOf(PackageStatus.class));
        ALLOWED.put(CANCELED, EnumSet.noneOf(PackageStatus.class));
        ALLOWED.put(FAILED, EnumSet.noneOf(PackageStatus.class));
    }

    private PackageStatusMachine() {
    }

    public static boolean isValidTransition(PackageStatus current, PackageStatus next) {
        if (current == null || next == null) {
            return false;
        }
        return ALLOWED.get(current).contains(next);
    }

    public static Set<PackageStatus> allowedNext(PackageStatus current) {
        return Collections.unmodifiableSet(ALLOWED.get(current));
    }

    public static boolean isTerminal(PackageStatus status) {
        return ALLOWED.get(status).isEmpty();
    }

    /**
     * @throws InvalidTransitionException if the edge is not in the table
     */
    public static void requireTransition(Long packageId, PackageStatus current, PackageStatus next) {
        if (!isValidTransition(current, next)) {
            log.warn("Invalid transition for package {}: {} -> {}. Allowed from {}: {}",
                    packageId, current, next, current, current == null ? Set.of() : ALLOWED.get(current));
            throw new InvalidTransitionException(packageId, current, next);
        }
    }
}
