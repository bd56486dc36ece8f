package com.chaski.deliveryservice.dto;

import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.enums.BidStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BidDTO implements Serializable {
    private Long id;
    private Long packageId;
    private Long courierId;
    private Long routeId;
    private Double proposedPrice;
    private Instant proposedPickupTime;
    private String message;
    private BidStatus status;
    private Instant createdAt;
    private Instant resolvedAt;

    public static BidDTO fromEntity(Bid bid) {
        return BidDTO.builder()
                .id(bid.getId())
                .packageId(bid.getPackageId())
                .courierId(bid.getCourierId())
                .routeId(bid.getRouteId())
                .proposedPrice(bid.getProposedPrice())
                .proposedPickupTime(bid.getProposedPickupTime())
                .message(bid.getMessage())
                .status(bid.getStatus())
                .createdAt(bid.getCreatedAt())
                .resolvedAt(bid.getResolvedAt())
                .build();
    }
}
