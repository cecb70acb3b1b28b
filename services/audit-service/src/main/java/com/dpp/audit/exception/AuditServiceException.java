package com.dpp.audit.exception;

/**
 * Base exception for failures on the audit write path (recording and anchoring).
 * Extends RuntimeException so that transactional boundaries roll back.
 */
public class AuditServiceException extends RuntimeException {

    private final String errorCode;

    public AuditServiceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public AuditServiceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
