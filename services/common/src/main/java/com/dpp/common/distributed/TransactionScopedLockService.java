package com.dpp.common.distributed;

/**
 * Named mutual exclusion scoped to the caller's transaction.
 *
 * <p>While a lock is held, no other caller can acquire the same name. Locks
 * acquired inside a transaction stay held until that transaction commits or
 * rolls back; callers must perform their whole critical section, including
 * the write, before the transaction ends.
 */
public interface TransactionScopedLockService {

    /**
     * Acquires the lock with the given name, waiting up to the configured wait time.
     *
     * @param lockName stable lock name, e.g. {@code "audit-chain:<tenant>"}
     * @return handle for the held lock
     * @throws LockTimeoutException if the lock could not be acquired in time
     */
    DistributedLock acquire(String lockName);
}
