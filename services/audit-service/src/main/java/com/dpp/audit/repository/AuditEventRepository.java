package com.dpp.audit.repository;

import com.dpp.audit.domain.AuditEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to audit chains plus the inherited insert used by the writer.
 * A {@code null} tenant id addresses the platform chain; the default methods
 * pick the matching {@code IsNull} query.
 */
@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    Optional<AuditEvent> findFirstByTenantIdOrderByChainSequenceDesc(UUID tenantId);

    Optional<AuditEvent> findFirstByTenantIdIsNullOrderByChainSequenceDesc();

    List<AuditEvent> findByTenantIdAndChainSequenceGreaterThanOrderByChainSequenceAsc(
            UUID tenantId, long chainSequence, Pageable pageable);

    List<AuditEvent> findByTenantIdIsNullAndChainSequenceGreaterThanOrderByChainSequenceAsc(
            long chainSequence, Pageable pageable);

    List<AuditEvent> findByTenantIdOrderByChainSequenceAsc(UUID tenantId);

    List<AuditEvent> findByTenantIdIsNullOrderByChainSequenceAsc();

    List<AuditEvent> findByTenantIdAndChainSequenceBetweenOrderByChainSequenceAsc(
            UUID tenantId, long first, long last);

    List<AuditEvent> findByTenantIdIsNullAndChainSequenceBetweenOrderByChainSequenceAsc(long first, long last);

    /** Every chain scope that has events; contains {@code null} when the platform chain exists. */
    @Query("select distinct e.tenantId from AuditEvent e")
    List<UUID> findChainScopes();

    /** Event with the highest sequence, i.e. the current chain head. */
    default Optional<AuditEvent> findChainHead(UUID tenantId) {
        return tenantId != null
                ? findFirstByTenantIdOrderByChainSequenceDesc(tenantId)
                : findFirstByTenantIdIsNullOrderByChainSequenceDesc();
    }

    default List<AuditEvent> findChainAfter(UUID tenantId, long afterSequence, Pageable pageable) {
        return tenantId != null
                ? findByTenantIdAndChainSequenceGreaterThanOrderByChainSequenceAsc(tenantId, afterSequence, pageable)
                : findByTenantIdIsNullAndChainSequenceGreaterThanOrderByChainSequenceAsc(afterSequence, pageable);
    }

    default List<AuditEvent> findChain(UUID tenantId) {
        return tenantId != null
                ? findByTenantIdOrderByChainSequenceAsc(tenantId)
                : findByTenantIdIsNullOrderByChainSequenceAsc();
    }

    default List<AuditEvent> findChainRange(UUID tenantId, long firstSequence, long lastSequence) {
        return tenantId != null
                ? findByTenantIdAndChainSequenceBetweenOrderByChainSequenceAsc(tenantId, firstSequence, lastSequence)
                : findByTenantIdIsNullAndChainSequenceBetweenOrderByChainSequenceAsc(firstSequence, lastSequence);
    }
}
