package com.dpp.audit.crypto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of replaying a hash chain. A broken chain is a normal result, not an error.
 *
 * <p>{@code firstBreakAt} is the zero-based position of the first event that failed
 * verification and equals {@code verifiedCount} whenever it is set.
 */
@Value
@Builder
public class ChainVerificationResult {

    boolean valid;
    int verifiedCount;
    Integer firstBreakAt;
    @Singular
    List<String> errors;

    public static ChainVerificationResult intact(int verifiedCount) {
        return ChainVerificationResult.builder()
                .valid(true)
                .verifiedCount(verifiedCount)
                .build();
    }

    public static ChainVerificationResult brokenAt(int index, String error) {
        return ChainVerificationResult.builder()
                .valid(false)
                .verifiedCount(index)
                .firstBreakAt(index)
                .error(error)
                .build();
    }
}
