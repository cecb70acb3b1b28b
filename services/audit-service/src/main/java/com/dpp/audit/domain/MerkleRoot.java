package com.dpp.audit.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Signed Merkle root over the contiguous range
 * {@code [firstSequence, lastSequence]} of one chain scope.
 */
@Entity
@Immutable
@Table(name = "audit_merkle_roots",
        indexes = @Index(name = "idx_audit_merkle_roots_range", columnList = "tenant_id, first_sequence, last_sequence"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@ToString(exclude = "tsaToken")
public class MerkleRoot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", updatable = false)
    private UUID tenantId;

    @Column(name = "root_hash", length = 64, nullable = false, updatable = false)
    private String rootHash;

    @Column(name = "event_count", nullable = false, updatable = false)
    private int eventCount;

    @Column(name = "first_sequence", nullable = false, updatable = false)
    private long firstSequence;

    @Column(name = "last_sequence", nullable = false, updatable = false)
    private long lastSequence;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String signature;

    @Column(name = "signature_kid", length = 128, updatable = false)
    private String signatureKid;

    @Column(name = "signature_algorithm", length = 32, updatable = false)
    private String signatureAlgorithm;

    @Column(name = "tsa_token", length = 65536, updatable = false)
    private byte[] tsaToken;

    @Column(name = "timestamp_hash_algorithm", length = 32, updatable = false)
    private String timestampHashAlgorithm;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean covers(long chainSequence) {
        return chainSequence >= firstSequence && chainSequence <= lastSequence;
    }
}
