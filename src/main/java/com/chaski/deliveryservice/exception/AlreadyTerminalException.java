package com.chaski.deliveryservice.exception;

import com.chaski.deliveryservice.enums.BidStatus;
import lombok.Getter;

@Getter
public class AlreadyTerminalException extends DeliveryException {

    private final Long bidId;
    private final BidStatus currentStatus;

    public AlreadyTerminalException(Long bidId, BidStatus currentStatus) {
        super(ErrorKind.ALREADY_TERMINAL, String.format(
                "Bid %d is already %s", bidId, currentStatus));
        this.bidId = bidId;
        this.currentStatus = currentStatus;
    }
}
