package com.dpp.audit.timestamp;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a best-effort timestamp request. Failures are values, not exceptions.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TimestampResult {

    public enum Status { GRANTED, FAILED, SKIPPED }

    private final Status status;
    private final byte[] token;
    private final String failureReason;

    public static TimestampResult granted(byte[] token) {
        return new TimestampResult(Status.GRANTED, token, null);
    }

    public static TimestampResult failed(String reason) {
        return new TimestampResult(Status.FAILED, null, reason);
    }

    public static TimestampResult skipped() {
        return new TimestampResult(Status.SKIPPED, null, null);
    }

    public boolean isGranted() {
        return status == Status.GRANTED;
    }
}
