package com.dpp.audit.controller;

import com.dpp.audit.exception.AnchorSigningException;
import com.dpp.audit.exception.AuditPersistenceException;
import com.dpp.audit.exception.AuditRecordNotFoundException;
import com.dpp.audit.exception.AuditServiceException;
import com.dpp.audit.exception.NothingToAnchorException;
import com.dpp.common.api.ApiResponse;
import com.dpp.common.distributed.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps audit failures onto the {@link ApiResponse} envelope.
 */
@Slf4j
@RestControllerAdvice(basePackageClasses = AuditIntegrityController.class)
public class AuditExceptionHandler {

    @ExceptionHandler(AuditRecordNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(AuditRecordNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), "AUDIT_RECORD_NOT_FOUND");
    }

    @ExceptionHandler(NothingToAnchorException.class)
    public ResponseEntity<ApiResponse<Void>> handleNothingToAnchor(NothingToAnchorException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler({IllegalArgumentException.class, IndexOutOfBoundsException.class})
    public ResponseEntity<ApiResponse<Void>> handleInvalidInput(RuntimeException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_INPUT");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "'", "INVALID_INPUT");
    }

    @ExceptionHandler(LockTimeoutException.class)
    public ResponseEntity<ApiResponse<Void>> handleLockTimeout(LockTimeoutException ex) {
        log.warn("Chain lock not acquired: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "LOCK_TIMEOUT");
    }

    @ExceptionHandler(AnchorSigningException.class)
    public ResponseEntity<ApiResponse<Void>> handleSigning(AnchorSigningException ex) {
        log.error("Anchoring refused, signing unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(AuditPersistenceException.class)
    public ResponseEntity<ApiResponse<Void>> handlePersistence(AuditPersistenceException ex) {
        log.error("Audit persistence failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(AuditServiceException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuditService(AuditServiceException ex) {
        log.error("Audit operation failed [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode());
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(ApiResponse.error(message, errorCode));
    }
}
