package com.dpp.audit.crypto;

import com.dpp.audit.exception.MalformedEventFieldException;
import org.springframework.stereotype.Component;

/**
 * Folds an event's canonical fields with the previous event hash.
 *
 * <p>{@code event_hash = hex(SHA-256(utf8(canonical_json(fields)) || utf8(prev_hash)))}.
 * The previous hash is taken as its 64 lowercase hex characters, not the decoded bytes.
 */
@Component
public class HashChainEncoder {

    public static final String GENESIS_HASH = "0".repeat(64);
    public static final String HASH_ALGORITHM = "sha-256";
    public static final String CANONICALIZATION = "rfc8785";

    public String computeEventHash(EventFields fields, String prevHash) {
        if (!Digests.isHexDigest(prevHash)) {
            throw new MalformedEventFieldException("prev_hash must be 64 lowercase hex characters");
        }
        String canonical = canonicalize(fields);
        return Digests.sha256Hex(canonical, prevHash);
    }

    public String canonicalize(EventFields fields) {
        return CanonicalJson.write(fields.toCanonicalObject());
    }
}
