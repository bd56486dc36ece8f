package com.chaski.deliveryservice.repository;

import com.chaski.deliveryservice.entity.CourierRoute;
import com.chaski.deliveryservice.enums.BidStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface RouteRepository extends JpaRepository<CourierRoute, Long> {
    List<CourierRoute> findByCourierIdAndActiveTrue(Long courierId);

    @Query("select r.id from CourierRoute r " +
            "where r.active = true and r.tripDate is not null and r.tripDate < :today order by r.id")
    List<Long> findActiveIdsWithTripDateBefore(@Param("today") LocalDate today);

    /**
     * Inactive routes that still have bids in the given status, e.g. PENDING bids a
     * clean-up pass could not reach.
     */
    @Query("select r from CourierRoute r where r.active = false and exists (" +
            "select b.id from Bid b where b.routeId = r.id and b.courierId = r.courierId and b.status = :status) " +
            "order by r.id")
    List<CourierRoute> findInactiveWithBidsInStatus(@Param("status") BidStatus status);
}
