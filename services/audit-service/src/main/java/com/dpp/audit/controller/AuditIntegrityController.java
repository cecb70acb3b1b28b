package com.dpp.audit.controller;

import com.dpp.audit.dto.AnchorResponse;
import com.dpp.audit.dto.ChainVerificationResponse;
import com.dpp.audit.dto.EventVerificationResponse;
import com.dpp.audit.dto.InclusionProofResponse;
import com.dpp.audit.dto.SignatureVerificationResponse;
import com.dpp.audit.service.AuditIntegrityService;
import com.dpp.audit.service.MerkleAnchorJob;
import com.dpp.common.api.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Integrity endpoints for auditors. Omitting {@code tenantId} addresses the platform chain.
 */
@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Audit Integrity", description = "Hash chain verification, Merkle anchoring and inclusion proofs")
public class AuditIntegrityController {

    private final AuditIntegrityService auditIntegrityService;
    private final MerkleAnchorJob merkleAnchorJob;

    @GetMapping("/verify/chain")
    @Operation(summary = "Replay and verify a chain scope")
    public ResponseEntity<ApiResponse<ChainVerificationResponse>> verifyChain(
            @RequestParam(required = false) UUID tenantId) {
        return ResponseEntity.ok(ApiResponse.success(auditIntegrityService.verifyChain(tenantId)));
    }

    @GetMapping("/verify/event/{eventId}")
    @Operation(summary = "Verify a single audit event against its predecessor")
    public ResponseEntity<ApiResponse<EventVerificationResponse>> verifyEvent(@PathVariable UUID eventId) {
        return ResponseEntity.ok(ApiResponse.success(auditIntegrityService.verifyEvent(eventId)));
    }

    @PostMapping("/anchor")
    @Operation(summary = "Anchor the next batch of unanchored events")
    public ResponseEntity<ApiResponse<AnchorResponse>> anchor(@RequestParam(required = false) UUID tenantId) {
        log.info("Manual anchor requested for tenant {}", tenantId);
        AnchorResponse response = AnchorResponse.from(merkleAnchorJob.anchorBatch(tenantId));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @GetMapping("/anchors")
    @Operation(summary = "List Merkle anchors of a chain scope")
    public ResponseEntity<ApiResponse<List<AnchorResponse>>> listAnchors(
            @RequestParam(required = false) UUID tenantId) {
        List<AnchorResponse> anchors = auditIntegrityService.listAnchors(tenantId).stream()
                .map(AnchorResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(anchors));
    }

    @GetMapping("/events/{eventId}/proof")
    @Operation(summary = "Inclusion proof of an event in its covering anchor")
    public ResponseEntity<ApiResponse<InclusionProofResponse>> inclusionProof(@PathVariable UUID eventId) {
        return ResponseEntity.ok(ApiResponse.success(auditIntegrityService.inclusionProof(eventId)));
    }

    @GetMapping("/anchors/{anchorId}/signature")
    @Operation(summary = "Verify an anchor's signature, root and timestamp")
    public ResponseEntity<ApiResponse<SignatureVerificationResponse>> verifyAnchor(@PathVariable UUID anchorId) {
        return ResponseEntity.ok(ApiResponse.success(auditIntegrityService.verifyAnchor(anchorId)));
    }
}
