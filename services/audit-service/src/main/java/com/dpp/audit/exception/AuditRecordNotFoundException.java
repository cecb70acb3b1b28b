package com.dpp.audit.exception;

import java.util.UUID;

public class AuditRecordNotFoundException extends RuntimeException {

    public AuditRecordNotFoundException(String recordType, UUID id) {
        super(recordType + " not found: " + id);
    }
}
