package com.chaski.deliveryservice.dto;

import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.PackageSize;
import com.chaski.deliveryservice.enums.PackageStatus;
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
public class PackageDTO implements Serializable {
    private Long id;
    private Long senderId;
    private String description;
    private PackageSize size;
    private Double weightKg;
    private String pickupAddress;
    private double pickupLat;
    private double pickupLng;
    private String dropoffAddress;
    private double dropoffLat;
    private double dropoffLng;
    private Double offeredPrice;
    private Double agreedPrice;
    private PackageStatus status;
    private Long courierId;
    private Long selectedBidId;
    private Instant createdAt;
    private Instant biddingDeadline;
    private int deadlineExtensionCount;
    private String deliveryProofReference;
    private Instant deliveredAt;
    private String failureReason;

    public static PackageDTO fromEntity(DeliveryPackage pkg) {
        return PackageDTO.builder()
                .id(pkg.getId())
                .senderId(pkg.getSenderId())
                .description(pkg.getDescription())
                .size(pkg.getSize())
                .weightKg(pkg.getWeightKg())
                .pickupAddress(pkg.getPickupAddress())
                .pickupLat(pkg.getPickupLat())
                .pickupLng(pkg.getPickupLng())
                .dropoffAddress(pkg.getDropoffAddress())
                .dropoffLat(pkg.getDropoffLat())
                .dropoffLng(pkg.getDropoffLng())
                .offeredPrice(pkg.getOfferedPrice())
                .agreedPrice(pkg.getAgreedPrice())
                .status(pkg.getStatus())
                .courierId(pkg.getCourierId())
                .selectedBidId(pkg.getSelectedBidId())
                .createdAt(pkg.getCreatedAt())
                .biddingDeadline(pkg.getBiddingDeadline())
                .deadlineExtensionCount(pkg.getDeadlineExtensionCount())
                .deliveryProofReference(pkg.getDeliveryProofReference())
                .deliveredAt(pkg.getDeliveredAt())
                .failureReason(pkg.getFailureReason())
                .build();
    }
}
