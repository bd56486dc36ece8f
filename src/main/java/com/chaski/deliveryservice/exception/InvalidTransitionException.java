package com.chaski.deliveryservice.exception;

import com.chaski.deliveryservice.enums.PackageStatus;
import lombok.Getter;

/**
 * Thrown when a trigger is not allowed from the package's current status.
 * Example: marking an OPEN_FOR_BIDS package as delivered.
 */
@Getter
public class InvalidTransitionException extends DeliveryException {

    private final Long packageId;
    private final PackageStatus currentStatus;
    private final PackageStatus requestedStatus;

    public InvalidTransitionException(Long packageId, PackageStatus currentStatus, PackageStatus requestedStatus) {
        super(ErrorKind.INVALID_TRANSITION, String.format(
                "Invalid status transition for package %d: %s -> %s",
                packageId, currentStatus, requestedStatus));
        this.packageId = packageId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
