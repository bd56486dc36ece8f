package com.chaski.deliveryservice.entity;

import com.chaski.deliveryservice.enums.PackageSize;
import com.chaski.deliveryservice.enums.PackageStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A package a sender wants delivered. Rows are never deleted; a package ends in
 * DELIVERED, CANCELED or FAILED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "packages", indexes = {
        @Index(name = "idx_packages_status_deadline", columnList = "status, biddingDeadline")
})
public class DeliveryPackage {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long senderId;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    private PackageSize size;

    private Double weightKg;

    @Column(nullable = false)
    private String pickupAddress;
    private double pickupLat;
    private double pickupLng;

    @Column(nullable = false)
    private String dropoffAddress;
    private double dropoffLat;
    private double dropoffLng;

    // What the sender is willing to pay; null means "make me an offer"
    private Double offeredPrice;

    private Double agreedPrice;

    @Enumerated(EnumType.STRING) @Builder.Default
    @Column(nullable = false)
    private PackageStatus status = PackageStatus.NEW;

    private Long courierId;

    private Long selectedBidId;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant statusChangedAt;

    private Instant biddingDeadline;

    @Builder.Default
    private int deadlineExtensionCount = 0;

    @Builder.Default
    private boolean deadlineWarningSent = false;

    private String deliveryProofReference;

    private Instant deliveredAt;

    @Column(columnDefinition = "TEXT")
    private String failureReason;
}
