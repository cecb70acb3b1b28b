package com.dpp.audit.crypto;

import com.dpp.audit.exception.MalformedEventFieldException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Replays persisted events against {@link HashChainEncoder}. Reports the first
 * break and never repairs anything.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainVerifier {

    private final HashChainEncoder hashChainEncoder;

    /**
     * Recomputes the event hash from the stored fields.
     *
     * @param prevHash previous event hash, or {@code null} for the genesis hash
     * @return false if the stored hash is missing or does not match
     */
    public boolean verifyEvent(ChainedEvent event, String prevHash) {
        if (event.getEventHash() == null) {
            return false;
        }
        String expectedPrev = prevHash != null ? prevHash : HashChainEncoder.GENESIS_HASH;
        try {
            return event.getEventHash().equals(recompute(event, expectedPrev));
        } catch (MalformedEventFieldException e) {
            log.warn("Stored event fields can no longer be canonicalized: {}", e.getMessage());
            return false;
        }
    }

    public ChainVerificationResult verifyHashChain(List<? extends ChainedEvent> orderedEvents) {
        String expectedPrev = HashChainEncoder.GENESIS_HASH;
        int verified = 0;

        for (int i = 0; i < orderedEvents.size(); i++) {
            ChainedEvent event = orderedEvents.get(i);

            if (!expectedPrev.equals(event.getPrevEventHash())) {
                return broken(i, String.format("Event at index %d: prev_event_hash mismatch (stored=%s, expected=%s)",
                        i, event.getPrevEventHash(), expectedPrev));
            }
            if (event.getEventHash() == null) {
                return broken(i, String.format("Event at index %d: missing event_hash", i));
            }
            String recomputed;
            try {
                recomputed = recompute(event, expectedPrev);
            } catch (MalformedEventFieldException e) {
                return broken(i, String.format("Event at index %d: hash mismatch (stored=%s, recomputed=unavailable: %s)",
                        i, event.getEventHash(), e.getMessage()));
            }
            if (!event.getEventHash().equals(recomputed)) {
                return broken(i, String.format("Event at index %d: hash mismatch (stored=%s, recomputed=%s)",
                        i, event.getEventHash(), recomputed));
            }

            verified++;
            expectedPrev = event.getEventHash();
        }

        return ChainVerificationResult.intact(verified);
    }

    private String recompute(ChainedEvent event, String prevHash) {
        return hashChainEncoder.computeEventHash(event.hashedFields(), prevHash);
    }

    private ChainVerificationResult broken(int index, String error) {
        log.warn("Audit chain break detected: {}", error);
        return ChainVerificationResult.brokenAt(index, error);
    }
}
