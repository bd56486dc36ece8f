package com.chaski.deliveryservice.exception;

/**
 * Error kinds surfaced to API callers. The presentation layer translates these
 * into localized messages.
 */
public enum ErrorKind {
    INVALID_TRANSITION,
    PACKAGE_NOT_BIDDABLE,
    DUPLICATE_BID,
    NOT_OWNER,
    ALREADY_TERMINAL,
    COURIER_NOT_ELIGIBLE,
    BUSY,
    NOT_FOUND
}
