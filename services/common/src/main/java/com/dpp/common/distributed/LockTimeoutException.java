package com.dpp.common.distributed;

/**
 * Exception thrown when a named lock cannot be acquired within the wait time.
 * Callers may retry the whole unit of work.
 */
public class LockTimeoutException extends RuntimeException {

    private final String lockName;
    private final long waitTimeMillis;

    public LockTimeoutException(String lockName, long waitTimeMillis) {
        super(String.format("Failed to acquire lock '%s' within %d ms", lockName, waitTimeMillis));
        this.lockName = lockName;
        this.waitTimeMillis = waitTimeMillis;
    }

    public LockTimeoutException(String lockName, String message, Throwable cause) {
        super(message, cause);
        this.lockName = lockName;
        this.waitTimeMillis = 0;
    }

    public String getLockName() {
        return lockName;
    }

    public long getWaitTimeMillis() {
        return waitTimeMillis;
    }
}
