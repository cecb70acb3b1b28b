package com.dpp.common.distributed;

import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;

/**
 * Transaction-scoped PostgreSQL advisory locks keyed by {@code hashtext(lockName)}.
 *
 * <p>The lock is taken with {@code pg_try_advisory_xact_lock}, polled with
 * exponential backoff until the wait time runs out. PostgreSQL releases it at
 * commit or rollback, so the returned handle is always transaction-bound.
 */
@Slf4j
public class PostgresAdvisoryLockService implements TransactionScopedLockService {

    static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_xact_lock(hashtext(:lockName))";

    private static final long INITIAL_BACKOFF_MS = 10;
    private static final long MAX_BACKOFF_MS = 250;

    private final EntityManager entityManager;
    private final Duration waitTime;

    public PostgresAdvisoryLockService(EntityManager entityManager, Duration waitTime) {
        this.entityManager = entityManager;
        this.waitTime = waitTime;
    }

    @Override
    public DistributedLock acquire(String lockName) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Advisory lock '" + lockName + "' requires an active transaction");
        }

        long waitMillis = waitTime.toMillis();
        long startTime = System.currentTimeMillis();
        int attempts = 0;

        while (true) {
            attempts++;
            Object acquired = entityManager.createNativeQuery(TRY_LOCK_SQL)
                    .setParameter("lockName", lockName)
                    .getSingleResult();

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Advisory lock acquired: {} after {} attempts", lockName, attempts);
                return new DistributedLock(lockName, true, () -> { });
            }

            long remaining = waitMillis - (System.currentTimeMillis() - startTime);
            if (remaining <= 0) {
                log.warn("Failed to acquire advisory lock: {} after {}ms", lockName, waitMillis);
                throw new LockTimeoutException(lockName, waitMillis);
            }

            long backoff = Math.min(INITIAL_BACKOFF_MS << Math.min(attempts - 1, 5), MAX_BACKOFF_MS);
            try {
                Thread.sleep(Math.min(backoff, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(lockName, "Interrupted while waiting for lock '" + lockName + "'", e);
            }
        }
    }
}
