package com.dpp.audit.crypto;

/**
 * A persisted link of a hash chain as seen by {@link ChainVerifier}.
 */
public interface ChainedEvent {

    String getEventHash();

    String getPrevEventHash();

    long getChainSequence();

    /**
     * The stored fields that were hashed when the event was written.
     */
    EventFields hashedFields();
}
