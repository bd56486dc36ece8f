package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.BidStatus;
import com.chaski.deliveryservice.enums.PackageEventType;
import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.event.PackageEvent;
import com.chaski.deliveryservice.exception.InvalidTransitionException;
import com.chaski.deliveryservice.exception.NotFoundException;
import com.chaski.deliveryservice.exception.NotOwnerException;
import com.chaski.deliveryservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PackageLifecycleServiceTest extends IntegrationTestSupport {

    private DeliveryPackage selectedPackage() {
        DeliveryPackage pkg = openPackage();
        Bid bid = bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 20.0));
        bidLedger.selectBid(bid.getId(), SENDER);
        return packageRepository.findById(pkg.getId()).orElseThrow();
    }

    @Test
    void createPackage_OpensForBidsWithBaseWindow() {
        DeliveryPackage pkg = openPackage();

        assertEquals(PackageStatus.OPEN_FOR_BIDS, pkg.getStatus());
        assertEquals(START.plus(Duration.ofHours(24)), pkg.getBiddingDeadline());
        assertEquals(0, pkg.getDeadlineExtensionCount());
        assertFalse(pkg.isDeadlineWarningSent());
        assertNull(pkg.getSelectedBidId());

        List<PackageEvent> events = publishedEvents();
        assertEquals(1, events.size());
        assertEquals(PackageEventType.PACKAGE_STATUS_CHANGED, events.get(0).getType());
        assertEquals(PackageStatus.NEW, events.get(0).getFromStatus());
        assertEquals(PackageStatus.OPEN_FOR_BIDS, events.get(0).getToStatus());
    }

    @Test
    void happyPath_SelectedToDelivered() {
        DeliveryPackage pkg = selectedPackage();

        assertEquals(PackageStatus.PENDING_PICKUP,
                packageLifecycle.confirmPickupScheduled(pkg.getId(), COURIER_A).getStatus());
        assertEquals(PackageStatus.IN_TRANSIT,
                packageLifecycle.confirmPickup(pkg.getId(), COURIER_A).getStatus());

        clock.advance(Duration.ofHours(2));
        DeliveryPackage delivered = packageLifecycle.markDelivered(pkg.getId(), COURIER_A, "proof/2026/abc.jpg");

        assertEquals(PackageStatus.DELIVERED, delivered.getStatus());
        assertEquals("proof/2026/abc.jpg", delivered.getDeliveryProofReference());
        assertEquals(START.plus(Duration.ofHours(2)), delivered.getDeliveredAt());
        assertEquals(pkg.getSelectedBidId(), delivered.getSelectedBidId());
    }

    @Test
    void pickup_ByAnotherCourier_NotOwner() {
        DeliveryPackage pkg = selectedPackage();

        assertThrows(NotOwnerException.class, () -> packageLifecycle.confirmPickupScheduled(pkg.getId(), COURIER_B));
        assertEquals(PackageStatus.BID_SELECTED, packageRepository.findById(pkg.getId()).orElseThrow().getStatus());
    }

    @Test
    void markDelivered_WhileOpenForBids_InvalidTransitionAndNoMutation() {
        DeliveryPackage pkg = openPackage();
        forgetPublishedEvents();

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> packageLifecycle.markDelivered(pkg.getId(), COURIER_A, "proof"));

        assertEquals(PackageStatus.OPEN_FOR_BIDS, ex.getCurrentStatus());
        assertEquals(PackageStatus.DELIVERED, ex.getRequestedStatus());
        DeliveryPackage reloaded = packageRepository.findById(pkg.getId()).orElseThrow();
        assertEquals(PackageStatus.OPEN_FOR_BIDS, reloaded.getStatus());
        assertNull(reloaded.getDeliveryProofReference());
        assertTrue(publishedEvents().isEmpty());
    }

    @Test
    void markDelivered_BlankProof_Rejected() {
        DeliveryPackage pkg = selectedPackage();

        assertThrows(IllegalArgumentException.class, () -> packageLifecycle.markDelivered(pkg.getId(), COURIER_A, " "));
    }

    @Test
    void scenarioE_CancelAfterSelection() {
        DeliveryPackage pkg = openPackage();
        Bid winner = bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 20.0));
        Bid loser = bidLedger.placeBid(COURIER_B, bidRequest(pkg.getId(), 25.0));
        bidLedger.selectBid(winner.getId(), SENDER);

        DeliveryPackage canceled = packageLifecycle.cancel(pkg.getId(), SENDER);

        assertEquals(PackageStatus.CANCELED, canceled.getStatus());
        assertNull(canceled.getSelectedBidId());
        assertNull(canceled.getBiddingDeadline());
        assertEquals(BidStatus.REJECTED, bidRepository.findById(winner.getId()).orElseThrow().getStatus());
        assertEquals(BidStatus.REJECTED, bidRepository.findById(loser.getId()).orElseThrow().getStatus());

        Long id = pkg.getId();
        assertThrows(InvalidTransitionException.class, () -> packageLifecycle.cancel(id, SENDER));
        assertThrows(InvalidTransitionException.class, () -> packageLifecycle.confirmPickupScheduled(id, COURIER_A));
        assertThrows(InvalidTransitionException.class, () -> packageLifecycle.confirmPickup(id, COURIER_A));
        assertThrows(InvalidTransitionException.class, () -> packageLifecycle.markDelivered(id, COURIER_A, "proof"));
        assertThrows(InvalidTransitionException.class, () -> packageLifecycle.reportFailure(id, COURIER_A, true, "lost"));
        assertThrows(InvalidTransitionException.class, () -> bidLedger.selectBid(winner.getId(), SENDER));
    }

    @Test
    void cancel_WhileOpen_WithdrawsPendingBids() {
        DeliveryPackage pkg = openPackage();
        Bid bid = bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 20.0));
        forgetPublishedEvents();

        packageLifecycle.cancel(pkg.getId(), SENDER);

        assertEquals(BidStatus.WITHDRAWN, bidRepository.findById(bid.getId()).orElseThrow().getStatus());
        assertTrue(publishedEvents().stream().anyMatch(e -> e.getType() == PackageEventType.BID_WITHDRAWN));
    }

    @Test
    void cancel_ByAnotherUser_NotOwner() {
        DeliveryPackage pkg = openPackage();

        assertThrows(NotOwnerException.class, () -> packageLifecycle.cancel(pkg.getId(), COURIER_A));
        assertEquals(PackageStatus.OPEN_FOR_BIDS, packageRepository.findById(pkg.getId()).orElseThrow().getStatus());
    }

    @Test
    void cancel_InTransit_InvalidTransition() {
        DeliveryPackage pkg = selectedPackage();
        packageLifecycle.confirmPickupScheduled(pkg.getId(), COURIER_A);
        packageLifecycle.confirmPickup(pkg.getId(), COURIER_A);

        assertThrows(InvalidTransitionException.class, () -> packageLifecycle.cancel(pkg.getId(), SENDER));
    }

    @Test
    void reportFailure_BySelectedCourier_KeepsSelection() {
        DeliveryPackage pkg = selectedPackage();
        packageLifecycle.confirmPickupScheduled(pkg.getId(), COURIER_A);

        DeliveryPackage failed = packageLifecycle.reportFailure(pkg.getId(), COURIER_A, false, "Vehicle broke down");

        assertEquals(PackageStatus.FAILED, failed.getStatus());
        assertEquals("Vehicle broke down", failed.getFailureReason());
        assertEquals(pkg.getSelectedBidId(), failed.getSelectedBidId());
    }

    @Test
    void reportFailure_ByStranger_NotOwner_ByOperator_Allowed() {
        DeliveryPackage pkg = selectedPackage();
        packageLifecycle.confirmPickupScheduled(pkg.getId(), COURIER_A);
        packageLifecycle.confirmPickup(pkg.getId(), COURIER_A);

        assertThrows(NotOwnerException.class, () -> packageLifecycle.reportFailure(pkg.getId(), COURIER_B, false, "?"));

        DeliveryPackage failed = packageLifecycle.reportFailure(pkg.getId(), 999L, true, "Package damaged");
        assertEquals(PackageStatus.FAILED, failed.getStatus());
    }

    @Test
    void selectBid_AfterDeadlineBeforeSweep_StillAllowed() {
        DeliveryPackage pkg = openPackage();
        Bid bid = bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 20.0));
        clock.advance(Duration.ofHours(25));

        assertEquals(BidStatus.SELECTED, bidLedger.selectBid(bid.getId(), SENDER).getStatus());
    }

    @Test
    void getPackage_Unknown_NotFound() {
        assertThrows(NotFoundException.class, () -> packageLifecycle.getPackage(12345L));
    }
}
