package com.chaski.deliveryservice.entity;

import com.chaski.deliveryservice.enums.BidStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "bids", indexes = {
        @Index(name = "idx_bids_package", columnList = "packageId"),
        @Index(name = "idx_bids_courier", columnList = "courierId")
})
public class Bid {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long packageId;

    @Column(nullable = false)
    private Long courierId;

    // Route the courier was travelling when they bid, if any
    private Long routeId;

    @Column(nullable = false)
    private Double proposedPrice;

    private Instant proposedPickupTime;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING) @Builder.Default
    @Column(nullable = false)
    private BidStatus status = BidStatus.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant resolvedAt;
}
