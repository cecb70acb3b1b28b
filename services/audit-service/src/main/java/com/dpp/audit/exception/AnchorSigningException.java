package com.dpp.audit.exception;

/**
 * The Merkle root could not be signed. Anchoring fails closed on this error.
 */
public class AnchorSigningException extends AuditServiceException {

    public AnchorSigningException(String message) {
        super(message, "ANCHOR_SIGNING_FAILED");
    }

    public AnchorSigningException(String message, Throwable cause) {
        super(message, "ANCHOR_SIGNING_FAILED", cause);
    }
}
