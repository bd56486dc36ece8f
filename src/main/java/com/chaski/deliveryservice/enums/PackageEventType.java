package com.chaski.deliveryservice.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PackageEventType {
    BID_PLACED("bid.placed"),
    BID_WITHDRAWN("bid.withdrawn"),
    BID_SELECTED("bid.selected"),
    BID_REJECTED("bid.rejected"),
    BID_EXPIRED("bid.expired"),
    PACKAGE_STATUS_CHANGED("package.status-changed"),
    DEADLINE_EXTENDED("package.deadline-extended"),
    BIDS_PURGED("package.bids-purged"),
    DEADLINE_WARNING("package.deadline-warning");

    private final String routingKey;
}
