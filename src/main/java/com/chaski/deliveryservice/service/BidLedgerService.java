package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.client.CourierEligibilityClient;
import com.chaski.deliveryservice.dto.BidDTO;
import com.chaski.deliveryservice.dto.PackageBidsDTO;
import com.chaski.deliveryservice.dto.PlaceBidRequest;
import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.entity.CourierRoute;
import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.BidStatus;
import com.chaski.deliveryservice.enums.PackageEventType;
import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.event.PackageEvent;
import com.chaski.deliveryservice.event.PackageEventPublisher;
import com.chaski.deliveryservice.exception.AlreadyTerminalException;
import com.chaski.deliveryservice.exception.CourierNotEligibleException;
import com.chaski.deliveryservice.exception.DeliveryException;
import com.chaski.deliveryservice.exception.DuplicateBidException;
import com.chaski.deliveryservice.exception.NotFoundException;
import com.chaski.deliveryservice.exception.NotOwnerException;
import com.chaski.deliveryservice.exception.PackageNotBiddableException;
import com.chaski.deliveryservice.repository.BidRepository;
import com.chaski.deliveryservice.repository.PackageRepository;
import com.chaski.deliveryservice.repository.RouteRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Bid records for packages. Every mutation runs under the package lock; reads don't lock.
 * Selection belongs to the package lifecycle since it also moves the package.
 */
@Slf4j
@Service
public class BidLedgerService {

    private static final Set<BidStatus> ACTIVE_STATUSES = EnumSet.of(BidStatus.PENDING, BidStatus.SELECTED);

    private final BidRepository bidRepository;
    private final PackageRepository packageRepository;
    private final RouteRepository routeRepository;
    private final PackageLockManager lockManager;
    private final PackageEventPublisher eventPublisher;
    private final CourierEligibilityClient eligibilityClient;
    private final Clock clock;

    private PackageLifecycleService packageLifecycle;

    // @Lazy setter injection breaks the ledger <-> lifecycle cycle at startup
    @Autowired
    @Lazy
    public void setPackageLifecycle(PackageLifecycleService packageLifecycle) {
        this.packageLifecycle = packageLifecycle;
    }

    public BidLedgerService(BidRepository bidRepository,
                            PackageRepository packageRepository,
                            RouteRepository routeRepository,
                            PackageLockManager lockManager,
                            PackageEventPublisher eventPublisher,
                            CourierEligibilityClient eligibilityClient,
                            Clock clock) {
        this.bidRepository = bidRepository;
        this.packageRepository = packageRepository;
        this.routeRepository = routeRepository;
        this.lockManager = lockManager;
        this.eventPublisher = eventPublisher;
        this.eligibilityClient = eligibilityClient;
        this.clock = clock;
    }

    /**
     * Places a PENDING bid. The package is checked once without the lock so that a
     * package that cannot take bids is refused before user-service is asked about the
     * courier, and again under the lock before anything is written.
     */
    public Bid placeBid(Long courierId, PlaceBidRequest request) {
        Long packageId = request.packageId();
        DeliveryPackage snapshot = packageRepository.findById(packageId)
                .orElseThrow(() -> new NotFoundException("Package", packageId));
        validateBiddable(snapshot, courierId, clock.instant());

        // Network call stays outside the lock
        if (!eligibilityClient.isEligibleToBid(courierId)) {
            throw new CourierNotEligibleException(courierId);
        }

        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadPackageForUpdate(packageId);
            Instant now = clock.instant();
            validateBiddable(pkg, courierId, now);
            if (request.routeId() != null) {
                requireUsableRoute(request.routeId(), courierId, packageId, now);
            }

            if (bidRepository.existsByPackageIdAndCourierIdAndStatusIn(packageId, courierId, ACTIVE_STATUSES)) {
                throw new DuplicateBidException(packageId, courierId);
            }

            Bid bid = Bid.builder()
                    .packageId(packageId)
                    .courierId(courierId)
                    .routeId(request.routeId())
                    .proposedPrice(request.proposedPrice())
                    .proposedPickupTime(request.proposedPickupTime())
                    .message(request.message())
                    .status(BidStatus.PENDING)
                    .createdAt(now)
                    .build();

            Bid saved = bidRepository.save(bid);
            log.info("Courier {} bid {} on package {} (bid {})", courierId, saved.getProposedPrice(), packageId, saved.getId());
            eventPublisher.publish(PackageEvent.forBid(PackageEventType.BID_PLACED, saved, pkg, now));
            return saved;
        });
    }

    public Bid withdrawBid(Long bidId, Long courierId) {
        Long packageId = findBid(bidId).getPackageId();
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadPackageForUpdate(packageId);
            Bid bid = findBid(bidId);

            if (!bid.getCourierId().equals(courierId)) {
                throw new NotOwnerException("Bid " + bidId + " belongs to another courier");
            }
            if (bid.getStatus() != BidStatus.PENDING) {
                throw new AlreadyTerminalException(bidId, bid.getStatus());
            }

            resolve(bid, BidStatus.WITHDRAWN, pkg, PackageEventType.BID_WITHDRAWN, clock.instant());
            log.info("Courier {} withdrew bid {} on package {}", courierId, bidId, packageId);
            return bid;
        });
    }

    public Bid selectBid(Long bidId, Long senderId) {
        return packageLifecycle.selectBid(bidId, senderId);
    }

    /**
     * Expires every PENDING bid on the package. Only the deadline policy calls this.
     *
     * @return number of bids expired
     */
    public int expireOverdue(Long packageId) {
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadPackageForUpdate(packageId);
            Instant now = clock.instant();
            List<Bid> pending = bidRepository.findByPackageIdAndStatus(packageId, BidStatus.PENDING);
            pending.forEach(bid -> resolve(bid, BidStatus.EXPIRED, pkg, PackageEventType.BID_EXPIRED, now));
            if (!pending.isEmpty()) {
                log.info("Expired {} pending bids on package {}", pending.size(), packageId);
            }
            return pending.size();
        });
    }

    /**
     * Withdraws the courier's PENDING bids that were placed from a route being taken
     * off the market. Bids resolved in the meantime are skipped. A bid that cannot be
     * withdrawn right now (its package is busy, say) is left PENDING for the route
     * expiry sweep to collect; it never stops the rest.
     *
     * @return number of bids withdrawn
     */
    public int withdrawPendingBidsForRoute(Long courierId, Long routeId) {
        int withdrawn = 0;
        for (Bid bid : bidRepository.findByCourierIdAndRouteIdAndStatus(courierId, routeId, BidStatus.PENDING)) {
            try {
                withdrawBid(bid.getId(), courierId);
                withdrawn++;
            } catch (AlreadyTerminalException e) {
                log.debug("Skipping bid {} on route {}: {}", bid.getId(), routeId, e.getMessage());
            } catch (DeliveryException e) {
                log.warn("Could not withdraw bid {} on route {}, leaving it for the next route sweep: {}",
                        bid.getId(), routeId, e.getMessage());
            }
        }
        if (withdrawn > 0) {
            log.info("Withdrew {} pending bids from route {} of courier {}", withdrawn, routeId, courierId);
        }
        return withdrawn;
    }

    public PackageBidsDTO getBidsForPackage(Long packageId, Long senderId) {
        DeliveryPackage pkg = packageRepository.findById(packageId)
                .orElseThrow(() -> new NotFoundException("Package", packageId));
        if (!pkg.getSenderId().equals(senderId)) {
            throw new NotOwnerException("You are not the sender of package " + packageId);
        }

        List<BidDTO> bids = bidRepository.findByPackageIdOrderByCreatedAtAsc(packageId).stream()
                .map(BidDTO::fromEntity)
                .toList();

        return PackageBidsDTO.builder()
                .packageId(packageId)
                .status(pkg.getStatus())
                .biddingDeadline(pkg.getBiddingDeadline())
                .deadlineExtensionCount(pkg.getDeadlineExtensionCount())
                .bids(bids)
                .build();
    }

    public List<BidDTO> getMyBids(Long courierId) {
        return bidRepository.findByCourierIdOrderByCreatedAtDesc(courierId).stream()
                .map(BidDTO::fromEntity)
                .toList();
    }

    // --- Called by the package lifecycle while it holds the package lock ---

    void markSelected(Bid bid, DeliveryPackage pkg, Instant now) {
        bid.setStatus(BidStatus.SELECTED);
        bid.setResolvedAt(now);
        bidRepository.save(bid);
        eventPublisher.publish(PackageEvent.forBid(PackageEventType.BID_SELECTED, bid, pkg, now));
    }

    int rejectPendingExcept(DeliveryPackage pkg, Long winningBidId, Instant now) {
        int rejected = 0;
        for (Bid bid : bidRepository.findByPackageIdAndStatus(pkg.getId(), BidStatus.PENDING)) {
            if (!bid.getId().equals(winningBidId)) {
                resolve(bid, BidStatus.REJECTED, pkg, PackageEventType.BID_REJECTED, now);
                rejected++;
            }
        }
        return rejected;
    }

    /**
     * PENDING bids are withdrawn and the SELECTED bid, if any, is rejected.
     */
    void resolveOnCancel(DeliveryPackage pkg, Instant now) {
        List<Bid> active = bidRepository.findByPackageIdAndStatusIn(pkg.getId(), ACTIVE_STATUSES);
        for (Bid bid : active) {
            if (bid.getStatus() == BidStatus.SELECTED) {
                resolve(bid, BidStatus.REJECTED, pkg, PackageEventType.BID_REJECTED, now);
            } else {
                resolve(bid, BidStatus.WITHDRAWN, pkg, PackageEventType.BID_WITHDRAWN, now);
            }
        }
    }

    // --- Helpers ---

    private void validateBiddable(DeliveryPackage pkg, Long courierId, Instant now) {
        if (pkg.getStatus() != PackageStatus.OPEN_FOR_BIDS) {
            throw new PackageNotBiddableException(pkg.getId(), "status is " + pkg.getStatus());
        }
        if (pkg.getBiddingDeadline() != null && !now.isBefore(pkg.getBiddingDeadline())) {
            throw new PackageNotBiddableException(pkg.getId(), "the bidding deadline has passed");
        }
        if (pkg.getSenderId().equals(courierId)) {
            throw new PackageNotBiddableException(pkg.getId(), "you cannot bid on your own package");
        }
    }

    private void requireUsableRoute(Long routeId, Long courierId, Long packageId, Instant now) {
        CourierRoute route = routeRepository.findById(routeId)
                .orElseThrow(() -> new NotFoundException("Route", routeId));
        if (!route.getCourierId().equals(courierId)) {
            throw new NotOwnerException("Route " + routeId + " belongs to another courier");
        }
        if (!route.isUsable(now)) {
            throw new PackageNotBiddableException(packageId, "route " + routeId + " is no longer active");
        }
    }

    private void resolve(Bid bid, BidStatus status, DeliveryPackage pkg, PackageEventType type, Instant now) {
        bid.setStatus(status);
        bid.setResolvedAt(now);
        bidRepository.save(bid);
        eventPublisher.publish(PackageEvent.forBid(type, bid, pkg, now));
    }

    private Bid findBid(Long bidId) {
        return bidRepository.findById(bidId)
                .orElseThrow(() -> new NotFoundException("Bid", bidId));
    }

    private DeliveryPackage loadPackageForUpdate(Long packageId) {
        return packageRepository.findByIdForUpdate(packageId)
                .orElseThrow(() -> new NotFoundException("Package", packageId));
    }
}
