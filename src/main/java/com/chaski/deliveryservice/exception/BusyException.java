package com.chaski.deliveryservice.exception;

/**
 * Lock contention on a package or courier. Safe for the client to retry.
 */
public class BusyException extends DeliveryException {

    public BusyException(String message) {
        super(ErrorKind.BUSY, message);
    }
}
