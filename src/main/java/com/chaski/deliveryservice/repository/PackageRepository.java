package com.chaski.deliveryservice.repository;

import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.PackageStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PackageRepository extends JpaRepository<DeliveryPackage, Long> {

    List<DeliveryPackage> findByStatus(PackageStatus status);

    /**
     * Row-locking read used inside a package mutation, so two service instances
     * sharing a database still serialize on the same package.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from DeliveryPackage p where p.id = :id")
    Optional<DeliveryPackage> findByIdForUpdate(@Param("id") Long id);

    @Query("select p.id from DeliveryPackage p " +
            "where p.status = :status and p.biddingDeadline is not null and p.biddingDeadline < :cutoff " +
            "order by p.biddingDeadline asc")
    List<Long> findIdsWithDeadlineBefore(@Param("status") PackageStatus status, @Param("cutoff") Instant cutoff);
}
