package com.chaski.deliveryservice.dto;

import com.chaski.deliveryservice.entity.CourierRoute;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteDTO {
    private Long id;
    private Long courierId;
    private String startAddress;
    private double startLat;
    private double startLng;
    private String endAddress;
    private double endLat;
    private double endLng;
    private double maxDeviationKm;
    private LocalDate tripDate;
    private boolean active;
    private Instant createdAt;

    public static RouteDTO fromEntity(CourierRoute route) {
        return RouteDTO.builder()
                .id(route.getId())
                .courierId(route.getCourierId())
                .startAddress(route.getStartAddress())
                .startLat(route.getStartLat())
                .startLng(route.getStartLng())
                .endAddress(route.getEndAddress())
                .endLat(route.getEndLat())
                .endLng(route.getEndLng())
                .maxDeviationKm(route.getMaxDeviationKm())
                .tripDate(route.getTripDate())
                .active(route.isActive())
                .createdAt(route.getCreatedAt())
                .build();
    }
}
