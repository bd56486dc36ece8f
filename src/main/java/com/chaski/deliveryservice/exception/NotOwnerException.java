package com.chaski.deliveryservice.exception;

public class NotOwnerException extends DeliveryException {

    public NotOwnerException(String message) {
        super(ErrorKind.NOT_OWNER, message);
    }
}
