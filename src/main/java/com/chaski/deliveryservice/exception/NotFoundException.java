package com.chaski.deliveryservice.exception;

public class NotFoundException extends DeliveryException {

    public NotFoundException(String resource, Long id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id);
    }
}
