package com.chaski.deliveryservice.enums;

/**
 * Outcome of applying the bidding-window policy to one package.
 */
public enum DeadlineAction {
    NONE,
    WARNED,
    EXTENDED,
    PURGED
}
