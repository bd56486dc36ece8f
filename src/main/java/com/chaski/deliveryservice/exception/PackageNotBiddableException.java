package com.chaski.deliveryservice.exception;

import lombok.Getter;

@Getter
public class PackageNotBiddableException extends DeliveryException {

    private final Long packageId;

    public PackageNotBiddableException(Long packageId, String reason) {
        super(ErrorKind.PACKAGE_NOT_BIDDABLE, "Package " + packageId + " is not open for bids: " + reason);
        this.packageId = packageId;
    }
}
