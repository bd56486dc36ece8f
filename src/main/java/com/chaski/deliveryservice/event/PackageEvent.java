package com.chaski.deliveryservice.event;

import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.BidStatus;
import com.chaski.deliveryservice.enums.PackageEventType;
import com.chaski.deliveryservice.enums.PackageStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Payload sent to the notification dispatcher. Formatting, localization and
 * delivery to users happen on the dispatcher's side.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class PackageEvent implements Serializable {

    private PackageEventType type;
    private Instant occurredAt;

    // Info about the package
    private Long packageId;
    private Long senderId;
    private PackageStatus fromStatus;
    private PackageStatus toStatus;
    private Instant biddingDeadline;
    private Integer deadlineExtensionCount;

    // Info about the bid, for bid events
    private Long bidId;
    private Long courierId;
    private Double amount;
    private BidStatus bidStatus;

    public static PackageEvent forBid(PackageEventType type, Bid bid, DeliveryPackage pkg, Instant at) {
        return PackageEvent.builder()
                .type(type)
                .occurredAt(at)
                .packageId(pkg.getId())
                .senderId(pkg.getSenderId())
                .bidId(bid.getId())
                .courierId(bid.getCourierId())
                .amount(bid.getProposedPrice())
                .bidStatus(bid.getStatus())
                .build();
    }

    public static PackageEvent forPackage(PackageEventType type, DeliveryPackage pkg,
                                          PackageStatus from, Instant at) {
        return PackageEvent.builder()
                .type(type)
                .occurredAt(at)
                .packageId(pkg.getId())
                .senderId(pkg.getSenderId())
                .courierId(pkg.getCourierId())
                .fromStatus(from)
                .toStatus(pkg.getStatus())
                .biddingDeadline(pkg.getBiddingDeadline())
                .deadlineExtensionCount(pkg.getDeadlineExtensionCount())
                .build();
    }
}
