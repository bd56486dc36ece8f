package com.chaski.deliveryservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record PlaceBidRequest(
        @NotNull Long packageId,
        @NotNull @Positive Double proposedPrice,
        Instant proposedPickupTime,
        @Size(max = 500) String message,
        Long routeId
) {}
