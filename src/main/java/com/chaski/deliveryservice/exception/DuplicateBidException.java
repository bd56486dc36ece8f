package com.chaski.deliveryservice.exception;

import lombok.Getter;

@Getter
public class DuplicateBidException extends DeliveryException {

    private final Long packageId;
    private final Long courierId;

    public DuplicateBidException(Long packageId, Long courierId) {
        super(ErrorKind.DUPLICATE_BID, String.format(
                "Courier %d already has an open bid on package %d", courierId, packageId));
        this.packageId = packageId;
        this.courierId = courierId;
    }
}
