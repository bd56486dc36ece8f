package com.chaski.deliveryservice.dto;

import com.chaski.deliveryservice.entity.DeliveryPackage;

import java.time.Instant;

/**
 * A package that fits a courier's route. Computed per request, never stored.
 */
public record MatchResult(
        Long packageId,
        double distanceFromRouteKm,
        double estimatedDetourKm,
        String description,
        String pickupAddress,
        String dropoffAddress,
        Double offeredPrice,
        Instant biddingDeadline,
        Instant createdAt
) {
    public static MatchResult of(DeliveryPackage pkg, double distanceFromRouteKm, double estimatedDetourKm) {
        return new MatchResult(
                pkg.getId(),
                distanceFromRouteKm,
                estimatedDetourKm,
                pkg.getDescription(),
                pkg.getPickupAddress(),
                pkg.getDropoffAddress(),
                pkg.getOfferedPrice(),
                pkg.getBiddingDeadline(),
                pkg.getCreatedAt());
    }
}
