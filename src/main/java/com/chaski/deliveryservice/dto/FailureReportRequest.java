package com.chaski.deliveryservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record FailureReportRequest(@NotBlank @Size(max = 1000) String reason) {}
