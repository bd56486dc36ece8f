package com.chaski.deliveryservice.exception;

import lombok.Getter;

@Getter
public abstract class DeliveryException extends RuntimeException {

    private final ErrorKind kind;

    protected DeliveryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
