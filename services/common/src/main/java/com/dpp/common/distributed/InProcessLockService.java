package com.dpp.common.distributed;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed mutex set for single-process deployments and tests.
 *
 * <p>Inside a transaction the lock is released after completion (commit or
 * rollback), so the next holder always observes the previous holder's writes.
 * Outside a transaction it is released when the handle is closed.
 */
@Slf4j
public class InProcessLockService implements TransactionScopedLockService {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTime;

    public InProcessLockService(Duration waitTime) {
        this.waitTime = waitTime;
    }

    @Override
    public DistributedLock acquire(String lockName) {
        ReentrantLock lock = locks.computeIfAbsent(lockName, name -> new ReentrantLock(true));

        boolean acquired;
        try {
            acquired = lock.tryLock(waitTime.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(lockName, "Interrupted while waiting for lock '" + lockName + "'", e);
        }
        if (!acquired) {
            log.warn("Failed to acquire lock: {} after {}ms", lockName, waitTime.toMillis());
            throw new LockTimeoutException(lockName, waitTime.toMillis());
        }

        boolean transactionBound = TransactionSynchronizationManager.isSynchronizationActive();
        DistributedLock handle = new DistributedLock(lockName, transactionBound, lock::unlock);
        if (transactionBound) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    handle.release();
                }
            });
        }

        log.debug("Lock acquired: {} (transactionBound={})", lockName, transactionBound);
        return handle;
    }

    /**
     * Whether any thread currently holds the named lock.
     */
    public boolean isLocked(String lockName) {
        ReentrantLock lock = locks.get(lockName);
        return lock != null && lock.isLocked();
    }
}
