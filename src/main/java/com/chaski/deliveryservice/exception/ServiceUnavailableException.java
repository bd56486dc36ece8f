package com.chaski.deliveryservice.exception;

import lombok.Getter;

/**
 * A collaborator service (for example user-service) could not answer in time.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {

    private final String service;

    public ServiceUnavailableException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }
}
