package com.dpp.audit.domain;

import com.dpp.audit.crypto.ChainedEvent;
import com.dpp.audit.crypto.EventFields;
import com.dpp.audit.crypto.MetadataValue;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
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
 * One link of a tenant's audit hash chain. Rows are append-only; the entity
 * has no setters and Hibernate never issues updates for it.
 */
@Entity
@Immutable
@Table(name = "audit_events",
        uniqueConstraints = @UniqueConstraint(name = "uq_audit_events_tenant_sequence",
                columnNames = {"tenant_id", "chain_sequence"}),
        indexes = @Index(name = "idx_audit_events_tenant_sequence", columnList = "tenant_id, chain_sequence"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@ToString(exclude = "metadata")
public class AuditEvent implements ChainedEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /** {@code null} for the platform scope. */
    @Column(name = "tenant_id", updatable = false)
    private UUID tenantId;

    @Column(nullable = false, updatable = false)
    private String action;

    @Column(name = "resource_type", nullable = false, updatable = false)
    private String resourceType;

    @Column(name = "resource_id", updatable = false)
    private String resourceId;

    @Column(updatable = false)
    private String subject;

    @Column(updatable = false)
    private String decision;

    @Column(name = "ip_address", length = 64, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    private MetadataValue metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "event_hash", length = 64, nullable = false, updatable = false)
    private String eventHash;

    @Column(name = "prev_event_hash", length = 64, nullable = false, updatable = false)
    private String prevEventHash;

    @Column(name = "chain_sequence", nullable = false, updatable = false)
    private long chainSequence;

    @Column(name = "hash_algorithm", length = 32, nullable = false, updatable = false)
    private String hashAlgorithm;

    @Column(name = "hash_canonicalization", length = 32, nullable = false, updatable = false)
    private String hashCanonicalization;

    @Override
    public EventFields hashedFields() {
        return EventFields.builder()
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .tenantId(tenantId != null ? tenantId.toString() : null)
                .subject(subject)
                .decision(decision)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .metadata(metadata)
                .build();
    }
}
