package com.chaski.deliveryservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "courier_routes", indexes = {
        @Index(name = "idx_routes_courier_active", columnList = "courierId, active")
})
public class CourierRoute {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long courierId;

    @Column(nullable = false)
    private String startAddress;
    private double startLat;
    private double startLng;

    @Column(nullable = false)
    private String endAddress;
    private double endLat;
    private double endLng;

    @Builder.Default
    private double maxDeviationKm = 5.0;

    private LocalDate tripDate;

    @Builder.Default
    private boolean active = true;

    @Column(nullable = false)
    private Instant createdAt;

    /**
     * Trip dates are calendar days in UTC; a route stays usable through its whole trip day.
     */
    public static LocalDate tripDayOf(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    public boolean isPastTrip(Instant now) {
        return tripDate != null && tripDate.isBefore(tripDayOf(now));
    }

    public boolean isUsable(Instant now) {
        return active && !isPastTrip(now);
    }
}
