package com.chaski.deliveryservice.repository;

import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.enums.BidStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface BidRepository extends JpaRepository<Bid, Long> {
    List<Bid> findByPackageIdOrderByCreatedAtAsc(Long packageId);
    List<Bid> findByCourierIdOrderByCreatedAtDesc(Long courierId);
    List<Bid> findByPackageIdAndStatus(Long packageId, BidStatus status);
    List<Bid> findByPackageIdAndStatusIn(Long packageId, Collection<BidStatus> statuses);
    List<Bid> findByCourierIdAndRouteIdAndStatus(Long courierId, Long routeId, BidStatus status);
    boolean existsByPackageIdAndCourierIdAndStatusIn(Long packageId, Long courierId, Collection<BidStatus> statuses);
    long countByPackageIdAndStatus(Long packageId, BidStatus status);
}
