package com.chaski.deliveryservice.dto;

import com.chaski.deliveryservice.enums.PackageSize;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreatePackageRequest(
        String description,
        PackageSize size,
        @Positive Double weightKg,
        @NotBlank String pickupAddress,
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double pickupLat,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double pickupLng,
        @NotBlank String dropoffAddress,
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double dropoffLat,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double dropoffLng,
        @Positive Double offeredPrice
) {}
