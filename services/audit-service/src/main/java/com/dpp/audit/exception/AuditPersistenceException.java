package com.dpp.audit.exception;

/**
 * Storage failure while writing an audit event or anchor. The surrounding
 * transaction has been rolled back; nothing was recorded.
 */
public class AuditPersistenceException extends AuditServiceException {

    public AuditPersistenceException(String message, Throwable cause) {
        super(message, "AUDIT_PERSISTENCE_FAILED", cause);
    }
}
