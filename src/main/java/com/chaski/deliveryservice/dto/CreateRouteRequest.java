package com.chaski.deliveryservice.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;

public record CreateRouteRequest(
        @NotBlank String startAddress,
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double startLat,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double startLng,
        @NotBlank String endAddress,
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double endLat,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double endLng,
        // null means the default of 5 km
        @Positive Double maxDeviationKm,
        LocalDate tripDate
) {}
