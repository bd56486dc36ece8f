package com.chaski.deliveryservice.dto;

import lombok.Data;

/**
 * Response of user-service's courier eligibility endpoint.
 */
@Data
public class CourierEligibilityDTO {
    private Long userId;
    private boolean verified;
    private boolean eligibleToBid;
}
