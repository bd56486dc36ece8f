package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.config.BiddingProperties;
import com.chaski.deliveryservice.dto.CreatePackageRequest;
import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.BidStatus;
import com.chaski.deliveryservice.enums.DeadlineAction;
import com.chaski.deliveryservice.enums.PackageEventType;
import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.event.PackageEvent;
import com.chaski.deliveryservice.event.PackageEventPublisher;
import com.chaski.deliveryservice.exception.AlreadyTerminalException;
import com.chaski.deliveryservice.exception.NotFoundException;
import com.chaski.deliveryservice.exception.NotOwnerException;
import com.chaski.deliveryservice.repository.BidRepository;
import com.chaski.deliveryservice.repository.PackageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Owns package status and the bidding window. Every transition is checked against
 * {@link PackageStatusMachine} and applied under the package lock; a rejected
 * trigger leaves the package untouched.
 */
@Slf4j
@Service
public class PackageLifecycleService {

    private final PackageRepository packageRepository;
    private final BidRepository bidRepository;
    private final BidLedgerService bidLedger;
    private final PackageLockManager lockManager;
    private final PackageEventPublisher eventPublisher;
    private final BiddingProperties properties;
    private final Clock clock;

    public PackageLifecycleService(PackageRepository packageRepository,
                                   BidRepository bidRepository,
                                   BidLedgerService bidLedger,
                                   PackageLockManager lockManager,
                                   PackageEventPublisher eventPublisher,
                                   BiddingProperties properties,
                                   Clock clock) {
        this.packageRepository = packageRepository;
        this.bidRepository = bidRepository;
        this.bidLedger = bidLedger;
        this.lockManager = lockManager;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stores the package and opens it for bids right away with a fresh window.
     */
    public DeliveryPackage createPackage(Long senderId, CreatePackageRequest request) {
        return lockManager.inTransaction(() -> {
            Instant now = clock.instant();
            DeliveryPackage pkg = DeliveryPackage.builder()
                    .senderId(senderId)
                    .description(request.description())
                    .size(request.size())
                    .weightKg(request.weightKg())
                    .pickupAddress(request.pickupAddress())
                    .pickupLat(request.pickupLat())
                    .pickupLng(request.pickupLng())
                    .dropoffAddress(request.dropoffAddress())
                    .dropoffLat(request.dropoffLat())
                    .dropoffLng(request.dropoffLng())
                    .offeredPrice(request.offeredPrice())
                    .status(PackageStatus.NEW)
                    .createdAt(now)
                    .statusChangedAt(now)
                    .build();
            pkg = packageRepository.save(pkg);

            pkg.setBiddingDeadline(now.plus(properties.getBaseWindow()));
            pkg.setDeadlineExtensionCount(0);
            pkg.setDeadlineWarningSent(false);
            transition(pkg, PackageStatus.OPEN_FOR_BIDS, now);
            return pkg;
        });
    }

    public DeliveryPackage getPackage(Long packageId) {
        return packageRepository.findById(packageId)
                .orElseThrow(() -> new NotFoundException("Package", packageId));
    }

    /**
     * Picks the winning bid. The bid becomes SELECTED, every other PENDING bid is
     * REJECTED and the package moves to BID_SELECTED, all in one unit of work.
     */
    public Bid selectBid(Long bidId, Long senderId) {
        Long packageId = findBid(bidId).getPackageId();
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadForUpdate(packageId);
            requireSender(pkg, senderId);

            Bid bid = findBid(bidId);
            if (bid.getStatus() == BidStatus.SELECTED) {
                throw new AlreadyTerminalException(bidId, bid.getStatus());
            }
            PackageStatusMachine.requireTransition(packageId, pkg.getStatus(), PackageStatus.BID_SELECTED);
            if (bid.getStatus() != BidStatus.PENDING) {
                throw new AlreadyTerminalException(bidId, bid.getStatus());
            }

            Instant now = clock.instant();
            bidLedger.markSelected(bid, pkg, now);
            int rejected = bidLedger.rejectPendingExcept(pkg, bidId, now);

            pkg.setSelectedBidId(bidId);
            pkg.setCourierId(bid.getCourierId());
            pkg.setAgreedPrice(bid.getProposedPrice());
            pkg.setBiddingDeadline(null);
            pkg.setDeadlineWarningSent(false);
            transition(pkg, PackageStatus.BID_SELECTED, now);

            log.info("Sender {} selected bid {} on package {} ({} other bids rejected)", senderId, bidId, packageId, rejected);
            return bid;
        });
    }

    /**
     * Applies the bidding-window policy to one OPEN_FOR_BIDS package. Runs against the
     * state read under the lock, so calling it again on an unchanged package does nothing.
     * <ul>
     *     <li>deadline passed, fewer than the maximum extensions: push the deadline out</li>
     *     <li>deadline passed, extensions used up: expire PENDING bids and restart the window</li>
     *     <li>deadline within the warning lead: warn the sender once per window</li>
     * </ul>
     */
    public DeadlineAction applyDeadlinePolicy(Long packageId) {
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadForUpdate(packageId);
            Instant deadline = pkg.getBiddingDeadline();
            if (pkg.getStatus() != PackageStatus.OPEN_FOR_BIDS || deadline == null) {
                return DeadlineAction.NONE;
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                if (pkg.getDeadlineExtensionCount() < properties.getMaxExtensions()) {
                    extendDeadline(pkg, now);
                    return DeadlineAction.EXTENDED;
                }
                purgeBids(pkg, now);
                return DeadlineAction.PURGED;
            }

            if (!pkg.isDeadlineWarningSent() && !now.isBefore(deadline.minus(properties.getWarningLead()))) {
                pkg.setDeadlineWarningSent(true);
                packageRepository.save(pkg);
                eventPublisher.publish(PackageEvent.forPackage(PackageEventType.DEADLINE_WARNING, pkg, pkg.getStatus(), now));
                log.info("Deadline warning for package {} (deadline {})", packageId, deadline);
                return DeadlineAction.WARNED;
            }
            return DeadlineAction.NONE;
        });
    }

    public DeliveryPackage confirmPickupScheduled(Long packageId, Long courierId) {
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadForUpdate(packageId);
            PackageStatusMachine.requireTransition(packageId, pkg.getStatus(), PackageStatus.PENDING_PICKUP);
            requireSelectedCourier(pkg, courierId);

            transition(pkg, PackageStatus.PENDING_PICKUP, clock.instant());
            return pkg;
        });
    }

    public DeliveryPackage confirmPickup(Long packageId, Long courierId) {
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadForUpdate(packageId);
            PackageStatusMachine.requireTransition(packageId, pkg.getStatus(), PackageStatus.IN_TRANSIT);
            requireSelectedCourier(pkg, courierId);

            transition(pkg, PackageStatus.IN_TRANSIT, clock.instant());
            return pkg;
        });
    }

    /**
     * Closes the delivery. The proof itself lives in the proof store; only its reference is kept.
     */
    public DeliveryPackage markDelivered(Long packageId, Long courierId, String proofReference) {
        if (proofReference == null || proofReference.isBlank()) {
            throw new IllegalArgumentException("A delivery proof reference is required");
        }
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadForUpdate(packageId);
            PackageStatusMachine.requireTransition(packageId, pkg.getStatus(), PackageStatus.DELIVERED);
            requireSelectedCourier(pkg, courierId);

            Instant now = clock.instant();
            pkg.setDeliveryProofReference(proofReference);
            pkg.setDeliveredAt(now);
            transition(pkg, PackageStatus.DELIVERED, now);
            return pkg;
        });
    }

    public DeliveryPackage cancel(Long packageId, Long senderId) {
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadForUpdate(packageId);
            requireSender(pkg, senderId);
            PackageStatusMachine.requireTransition(packageId, pkg.getStatus(), PackageStatus.CANCELED);

            Instant now = clock.instant();
            bidLedger.resolveOnCancel(pkg, now);
            pkg.setBiddingDeadline(null);
            pkg.setSelectedBidId(null);
            pkg.setCourierId(null);
            transition(pkg, PackageStatus.CANCELED, now);
            return pkg;
        });
    }

    /**
     * @param operator true when the reporter acts as a platform operator rather than the courier
     */
    public DeliveryPackage reportFailure(Long packageId, Long reporterId, boolean operator, String reason) {
        return lockManager.withPackageLock(packageId, () -> {
            DeliveryPackage pkg = loadForUpdate(packageId);
            PackageStatusMachine.requireTransition(packageId, pkg.getStatus(), PackageStatus.FAILED);
            if (!operator) {
                requireSelectedCourier(pkg, reporterId);
            }

            pkg.setFailureReason(reason);
            transition(pkg, PackageStatus.FAILED, clock.instant());
            log.warn("Package {} failed, reported by {}{}: {}", packageId, reporterId, operator ? " (operator)" : "", reason);
            return pkg;
        });
    }

    // --- Window policy ---

    private void extendDeadline(DeliveryPackage pkg, Instant now) {
        PackageStatusMachine.requireTransition(pkg.getId(), pkg.getStatus(), PackageStatus.OPEN_FOR_BIDS);
        pkg.setBiddingDeadline(now.plus(properties.getExtensionWindow()));
        pkg.setDeadlineExtensionCount(pkg.getDeadlineExtensionCount() + 1);
        pkg.setDeadlineWarningSent(false);
        pkg.setStatusChangedAt(now);
        packageRepository.save(pkg);

        eventPublisher.publish(PackageEvent.forPackage(PackageEventType.DEADLINE_EXTENDED, pkg, pkg.getStatus(), now));
        log.info("Extended bidding deadline of package {} to {} (extension {} of {})",
                pkg.getId(), pkg.getBiddingDeadline(), pkg.getDeadlineExtensionCount(), properties.getMaxExtensions());
    }

    private void purgeBids(DeliveryPackage pkg, Instant now) {
        PackageStatusMachine.requireTransition(pkg.getId(), pkg.getStatus(), PackageStatus.OPEN_FOR_BIDS);
        int expired = bidLedger.expireOverdue(pkg.getId());

        pkg.setBiddingDeadline(now.plus(properties.getBaseWindow()));
        pkg.setDeadlineExtensionCount(0);
        pkg.setDeadlineWarningSent(false);
        pkg.setStatusChangedAt(now);
        packageRepository.save(pkg);

        eventPublisher.publish(PackageEvent.forPackage(PackageEventType.BIDS_PURGED, pkg, pkg.getStatus(), now));
        log.info("Bidding window of package {} ran out after {} extensions: {} bids expired, reopened until {}",
                pkg.getId(), properties.getMaxExtensions(), expired, pkg.getBiddingDeadline());
    }

    // --- Helpers ---

    private void transition(DeliveryPackage pkg, PackageStatus target, Instant now) {
        PackageStatus from = pkg.getStatus();
        PackageStatusMachine.requireTransition(pkg.getId(), from, target);

        pkg.setStatus(target);
        pkg.setStatusChangedAt(now);
        packageRepository.save(pkg);

        eventPublisher.publish(PackageEvent.forPackage(PackageEventType.PACKAGE_STATUS_CHANGED, pkg, from, now));
        log.info("Package {}: {} -> {}", pkg.getId(), from, target);
    }

    private void requireSender(DeliveryPackage pkg, Long senderId) {
        if (!pkg.getSenderId().equals(senderId)) {
            throw new NotOwnerException("You are not the sender of package " + pkg.getId());
        }
    }

    private void requireSelectedCourier(DeliveryPackage pkg, Long courierId) {
        if (pkg.getCourierId() == null || !pkg.getCourierId().equals(courierId)) {
            throw new NotOwnerException("You are not the selected courier for package " + pkg.getId());
        }
    }

    private Bid findBid(Long bidId) {
        return bidRepository.findById(bidId)
                .orElseThrow(() -> new NotFoundException("Bid", bidId));
    }

    private DeliveryPackage loadForUpdate(Long packageId) {
        return packageRepository.findByIdForUpdate(packageId)
                .orElseThrow(() -> new NotFoundException("Package", packageId));
    }
}
