package com.dpp.audit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.dpp.audit.domain.MerkleRoot;

import java.time.Instant;
import java.util.UUID;

/**
 * Anchor Response DTO. The timestamp token itself is not exposed, only whether one exists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnchorResponse {
    private UUID id;
    private UUID tenantId;
    private String rootHash;
    private int eventCount;
    private long firstSequence;
    private long lastSequence;
    private String signature;
    private String signatureKid;
    private String signatureAlgorithm;
    private boolean timestamped;
    private String timestampHashAlgorithm;
    private Instant createdAt;

    public static AnchorResponse from(MerkleRoot root) {
        return AnchorResponse.builder()
                .id(root.getId())
                .tenantId(root.getTenantId())
                .rootHash(root.getRootHash())
                .eventCount(root.getEventCount())
                .firstSequence(root.getFirstSequence())
                .lastSequence(root.getLastSequence())
                .signature(root.getSignature())
                .signatureKid(root.getSignatureKid())
                .signatureAlgorithm(root.getSignatureAlgorithm())
                .timestamped(root.getTsaToken() != null)
                .timestampHashAlgorithm(root.getTimestampHashAlgorithm())
                .createdAt(root.getCreatedAt())
                .build();
    }
}
