package com.chaski.deliveryservice.service;

import com.chaski.deliveryservice.config.BiddingProperties;
import com.chaski.deliveryservice.exception.BusyException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes mutations per package (and route activation per courier).
 * <p>
 * Each unit of work runs inside a transaction that commits before the lock is
 * released. Locks are fair and reentrant, so a locked operation can call another
 * one on the same package. A lock that can't be taken within the configured
 * timeout fails with {@link BusyException}, which is retried a bounded number of
 * times before it reaches the caller.
 */
@Slf4j
@Component
public class PackageLockManager {

    private final ConcurrentMap<Long, ReentrantLock> packageLocks = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, ReentrantLock> courierLocks = new ConcurrentHashMap<>();

    private final TransactionTemplate transactionTemplate;
    private final Retry packageLockRetry;
    private final BiddingProperties properties;

    public PackageLockManager(PlatformTransactionManager transactionManager,
                              Retry packageLockRetry,
                              BiddingProperties properties) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.packageLockRetry = packageLockRetry;
        this.properties = properties;
    }

    public <T> T withPackageLock(Long packageId, Supplier<T> work) {
        return Retry.decorateSupplier(packageLockRetry,
                () -> lockAndRun(packageLocks, "Package", packageId, work)).get();
    }

    public <T> T withCourierLock(Long courierId, Supplier<T> work) {
        return Retry.decorateSupplier(packageLockRetry,
                () -> lockAndRun(courierLocks, "Courier", courierId, work)).get();
    }

    /**
     * Transaction without a lock, for creating rows nobody else can see yet.
     */
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    private <T> T lockAndRun(ConcurrentMap<Long, ReentrantLock> locks, String kind, Long id, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(id, key -> new ReentrantLock(true));
        long timeoutMillis = properties.getLockTimeout().toMillis();

        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusyException("Interrupted while waiting for " + kind.toLowerCase() + " " + id);
        }

        if (!acquired) {
            log.warn("{} {} still locked after {}ms", kind, id, timeoutMillis);
            throw new BusyException(kind + " " + id + " is busy, please retry");
        }

        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }
}
