package com.dpp.common.distributed;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a named lock held by the current unit of work.
 * Implements AutoCloseable for use with try-with-resources pattern.
 *
 * <p>A transaction-bound lock is released when the surrounding transaction
 * completes, so {@link #close()} leaves it held. An unbound lock is released
 * on close.
 */
@Slf4j
@Getter
public class DistributedLock implements AutoCloseable {

    private final String lockName;
    private final boolean transactionBound;
    private final Instant acquiredAt;
    private final String threadName;

    @Getter(lombok.AccessLevel.NONE)
    private final Runnable releaseAction;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean(false);

    public DistributedLock(String lockName, boolean transactionBound, Runnable releaseAction) {
        this.lockName = lockName;
        this.transactionBound = transactionBound;
        this.releaseAction = releaseAction;
        this.acquiredAt = Instant.now();
        this.threadName = Thread.currentThread().getName();
    }

    /**
     * Releases the lock now. Safe to call more than once.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            releaseAction.run();
            log.trace("Lock released: {}", lockName);
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!transactionBound) {
            release();
        }
    }

    @Override
    public String toString() {
        return String.format("DistributedLock[name=%s, acquired=%s, transactionBound=%s, released=%s, thread=%s]",
                lockName, acquiredAt, transactionBound, released.get(), threadName);
    }
}
