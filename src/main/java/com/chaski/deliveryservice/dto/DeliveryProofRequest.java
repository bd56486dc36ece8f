package com.chaski.deliveryservice.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Reference to the proof artifact (photo, signature) held by the proof store.
 */
public record DeliveryProofRequest(@NotBlank String proofReference) {}
