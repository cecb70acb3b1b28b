package com.dpp.audit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Chain Verification Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainVerificationResponse {
    private UUID tenantId;
    private boolean valid;
    private int verifiedCount;
    private Integer firstBreakAt;
    private List<String> errors;
    private Instant verifiedAt;
}
