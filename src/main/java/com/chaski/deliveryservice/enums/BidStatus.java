package com.chaski.deliveryservice.enums;

public enum BidStatus {
    PENDING,
    SELECTED,
    REJECTED,
    WITHDRAWN,
    EXPIRED;

    /**
     * True while the bid still occupies the courier's single slot on a package.
     */
    public boolean isActive() {
        return this == PENDING || this == SELECTED;
    }
}
