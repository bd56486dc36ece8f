package com.chaski.deliveryservice.enums;

public enum PackageStatus {
    NEW,
    OPEN_FOR_BIDS,
    BID_SELECTED,
    PENDING_PICKUP,
    IN_TRANSIT,
    DELIVERED,
    CANCELED,
    FAILED
}
