package com.chaski.deliveryservice.exception;

public class CourierNotEligibleException extends DeliveryException {

    public CourierNotEligibleException(Long courierId) {
        super(ErrorKind.COURIER_NOT_ELIGIBLE, "Courier " + courierId + " is not eligible to bid");
    }
}
