package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.entity.Bid;
import com.chaski.deliveryservice.entity.DeliveryPackage;
import com.chaski.deliveryservice.enums.BidStatus;
import com.chaski.deliveryservice.enums.DeadlineAction;
import com.chaski.deliveryservice.enums.PackageStatus;
import com.chaski.deliveryservice.exception.AlreadyTerminalException;
import com.chaski.deliveryservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The sender selecting a bid while the sweep purges the same package: the package lock
 * lets exactly one of them win, and the loser sees the winner's result.
 */
class SelectionDeadlineRaceTest extends IntegrationTestSupport {

    private static final int ROUNDS = 20;

    private ExecutorService pool;

    @BeforeEach
    void startPool() {
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void stopPool() {
        pool.shutdownNow();
    }

    private BidStatus statusOf(Bid bid) {
        return bidRepository.findById(bid.getId()).orElseThrow().getStatus();
    }

    @Test
    void selectAgainstPurge_ExactlyOneConsistentOutcome() throws Exception {
        int selectionWon = 0;
        int purgeWon = 0;

        for (int round = 0; round < ROUNDS; round++) {
            DeliveryPackage pkg = openPackage();
            Bid chosen = bidLedger.placeBid(COURIER_A, bidRequest(pkg.getId(), 20.0));
            Bid other = bidLedger.placeBid(COURIER_B, bidRequest(pkg.getId(), 24.0));

            // Use up both extensions so the next policy run purges
            clock.advance(Duration.ofHours(24));
            assertEquals(DeadlineAction.EXTENDED, packageLifecycle.applyDeadlinePolicy(pkg.getId()));
            clock.advance(Duration.ofHours(12));
            assertEquals(DeadlineAction.EXTENDED, packageLifecycle.applyDeadlinePolicy(pkg.getId()));
            clock.advance(Duration.ofHours(12));

            CountDownLatch go = new CountDownLatch(1);
            Future<Bid> selection = pool.submit(() -> {
                go.await();
                return bidLedger.selectBid(chosen.getId(), SENDER);
            });
            Future<DeadlineAction> policy = pool.submit(() -> {
                go.await();
                return packageLifecycle.applyDeadlinePolicy(pkg.getId());
            });
            go.countDown();

            DeadlineAction action = policy.get(10, TimeUnit.SECONDS);
            Throwable selectionFailure = null;
            try {
                selection.get(10, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                selectionFailure = e.getCause();
            }

            DeliveryPackage after = packageRepository.findById(pkg.getId()).orElseThrow();
            if (selectionFailure == null) {
                selectionWon++;
                assertEquals(DeadlineAction.NONE, action);
                assertEquals(PackageStatus.BID_SELECTED, after.getStatus());
                assertEquals(chosen.getId(), after.getSelectedBidId());
                assertEquals(BidStatus.SELECTED, statusOf(chosen));
                assertEquals(BidStatus.REJECTED, statusOf(other));
            } else {
                purgeWon++;
                assertInstanceOf(AlreadyTerminalException.class, selectionFailure);
                assertEquals(DeadlineAction.PURGED, action);
                assertEquals(PackageStatus.OPEN_FOR_BIDS, after.getStatus());
                assertEquals(0, after.getDeadlineExtensionCount());
                assertNull(after.getSelectedBidId());
                assertEquals(BidStatus.EXPIRED, statusOf(chosen));
                assertEquals(BidStatus.EXPIRED, statusOf(other));
            }
        }

        assertEquals(ROUNDS, selectionWon + purgeWon);
    }
}
