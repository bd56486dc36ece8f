package com.chaski.deliveryservice.scheduler;

import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.BidStatus;
import com.chaski.deliveryservice.enums.DeadlineAction;
import com.chaski.deliveryservice.enums.PackageEventType;
import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineSweepIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private DeadlineScheduler deadlineScheduler;

    private DeliveryPackage reload(DeliveryPackage pkg) {
        return packageRepository.findById(pkg.getId()).orElseThrow();
    }

    @Test
    void scenarioC_ExtendTwiceThenPurge() {
        DeliveryPackage pkg = openPackage();
        Bid bid = bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 20.0));

        clock.advance(Duration.ofHours(24));
        SweepReport first = deadlineScheduler.sweep();
        assertEquals(1, first.extended());
        DeliveryPackage afterFirst = reload(pkg);
        assertEquals(1, afterFirst.getDeadlineExtensionCount());
        assertEquals(clock.instant().plus(Duration.ofHours(12)), afterFirst.getBiddingDeadline());
        assertEquals(BidStatus.PENDING, bidRepository.findById(bid.getId()).orElseThrow().getStatus());

        clock.advance(Duration.ofHours(12));
        assertEquals(1, deadlineScheduler.sweep().extended());
        assertEquals(2, reload(pkg).getDeadlineExtensionCount());

        clock.advance(Duration.ofHours(12));
        forgetPublishedEvents();
        SweepReport third = deadlineScheduler.sweep();

        assertEquals(1, third.purged());
        DeliveryPackage purged = reload(pkg);
        assertEquals(PackageStatus.OPEN_FOR_BIDS, purged.getStatus());
        assertEquals(0, purged.getDeadlineExtensionCount());
        assertEquals(clock.instant().plus(Duration.ofHours(24)), purged.getBiddingDeadline());
        assertEquals(BidStatus.EXPIRED, bidRepository.findById(bid.getId()).orElseThrow().getStatus());
        assertTrue(publishedEvents().stream().anyMatch(e -> e.getType() == PackageEventType.BIDS_PURGED));
        assertTrue(publishedEvents().stream().anyMatch(e -> e.getType() == PackageEventType.BID_EXPIRED
                && e.getCourierId().equals(COURIER_A)));

        // The courier can bid again in the new window
        assertEquals(BidStatus.PENDING, bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 19.0)).getStatus());
    }

    @Test
    void extensionCountNeverExceedsMaximum() {
        DeliveryPackage pkg = openPackage();

        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofHours(25));
            deadlineScheduler.sweep();
            int count = reload(pkg).getDeadlineExtensionCount();
            assertTrue(count >= 0 && count <= 2, "extension count " + count);
        }
    }

    @Test
    void sweepTwiceWithoutTimePassing_SecondIsNoOp() {
        DeliveryPackage pkg = openPackage();
        clock.advance(Duration.ofHours(24));

        assertEquals(1, deadlineScheduler.sweep().extended());
        DeliveryPackage afterFirst = reload(pkg);

        SweepReport second = deadlineScheduler.sweep();
        assertEquals(0, second.extended() + second.purged() + second.warned());
        assertEquals(DeadlineAction.NONE, packageLifecycle.applyDeadlinePolicy(pkg.getId()));

        DeliveryPackage afterSecond = reload(pkg);
        assertEquals(afterFirst.getBiddingDeadline(), afterSecond.getBiddingDeadline());
        assertEquals(afterFirst.getDeadlineExtensionCount(), afterSecond.getDeadlineExtensionCount());
    }

    @Test
    void warningSentOncePerWindow() {
        DeliveryPackage pkg = openPackage();
        clock.advance(Duration.ofHours(19));

        assertEquals(1, deadlineScheduler.sweep().warned());
        assertTrue(reload(pkg).isDeadlineWarningSent());

        clock.advance(Duration.ofHours(1));
        SweepReport again = deadlineScheduler.sweep();
        assertEquals(1, again.examined());
        assertEquals(0, again.warned());
        assertEquals(1, publishedEvents().stream().filter(e -> e.getType() == PackageEventType.DEADLINE_WARNING).count());

        // Extension opens a new window with its own warning
        clock.advance(Duration.ofHours(4));
        assertEquals(1, deadlineScheduler.sweep().extended());
        assertFalse(reload(pkg).isDeadlineWarningSent());
        clock.advance(Duration.ofHours(7));
        assertEquals(1, deadlineScheduler.sweep().warned());
    }

    @Test
    void sweepIgnoresSelectedPackages() {
        DeliveryPackage pkg = openPackage();
        Bid bid = bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 20.0));
        bidLedger.selectBid(bid.getId(), SENDER);
        clock.advance(Duration.ofDays(3));

        assertEquals(0, deadlineScheduler.sweep().examined());
        assertEquals(DeadlineAction.NONE, packageLifecycle.applyDeadlinePolicy(pkg.getId()));
        assertEquals(PackageStatus.BID_SELECTED, reload(pkg).getStatus());
    }
}
