package com.dpp.audit.service;

import com.dpp.audit.crypto.EventFields;
import com.dpp.audit.crypto.HashChainEncoder;
import com.dpp.audit.crypto.MetadataValue;
import com.dpp.audit.domain.AuditEvent;
import com.dpp.audit.exception.AuditPersistenceException;
import com.dpp.audit.exception.MalformedEventFieldException;
import com.dpp.audit.repository.AuditEventRepository;
import com.dpp.common.distributed.DistributedLock;
import com.dpp.common.distributed.TransactionScopedLockService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Appends events to a tenant's hash chain.
 *
 * <p>The chain lock is taken before the head is read and held until the
 * surrounding transaction ends, so reading the head, hashing and inserting
 * form one critical section per chain scope. Unrelated tenants never contend.
 */
@Slf4j
@Service
public class AuditEventWriter {

    private final AuditEventRepository auditEventRepository;
    private final HashChainEncoder hashChainEncoder;
    private final TransactionScopedLockService lockService;
    private final Clock clock;

    private final Counter eventsRecordedCounter;
    private final Timer recordTimer;

    public AuditEventWriter(AuditEventRepository auditEventRepository,
                            HashChainEncoder hashChainEncoder,
                            TransactionScopedLockService lockService,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.auditEventRepository = auditEventRepository;
        this.hashChainEncoder = hashChainEncoder;
        this.lockService = lockService;
        this.clock = clock;

        this.eventsRecordedCounter = Counter.builder("audit.events.recorded")
                .description("Audit events appended to a hash chain")
                .register(meterRegistry);
        this.recordTimer = Timer.builder("audit.events.record.duration")
                .description("Time to lock, hash and persist one audit event")
                .register(meterRegistry);
    }

    @Transactional
    public AuditEvent recordEvent(UUID tenantId, String action, String resourceType, String resourceId,
                                  String subject, String decision, MetadataValue metadata) {
        return recordEvent(AuditEventRequest.builder()
                .tenantId(tenantId)
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .subject(subject)
                .decision(decision)
                .metadata(metadata)
                .build());
    }

    /**
     * @throws MalformedEventFieldException when action or resource type is blank
     * @throws com.dpp.common.distributed.LockTimeoutException when the chain lock is not
     *         obtained in time; safe to retry
     * @throws AuditPersistenceException when the insert fails; nothing was recorded
     */
    @Transactional
    public AuditEvent recordEvent(AuditEventRequest request) {
        if (!StringUtils.hasText(request.getAction())) {
            throw new MalformedEventFieldException("action is required");
        }
        if (!StringUtils.hasText(request.getResourceType())) {
            throw new MalformedEventFieldException("resource_type is required");
        }
        Timer.Sample sample = Timer.start();
        try {
            return append(request);
        } finally {
            sample.stop(recordTimer);
        }
    }

    private AuditEvent append(AuditEventRequest request) {
        UUID tenantId = request.getTenantId();
        MetadataValue metadata = request.getMetadata() instanceof MetadataValue.NullValue ? null : request.getMetadata();

        try (DistributedLock lock = lockService.acquire(ChainLocks.chainLock(tenantId))) {
            long sequence = 0L;
            String prevHash = HashChainEncoder.GENESIS_HASH;
            AuditEvent head = auditEventRepository.findChainHead(tenantId).orElse(null);
            if (head != null) {
                sequence = head.getChainSequence() + 1;
                prevHash = head.getEventHash();
            }

            EventFields fields = EventFields.builder()
                    .action(request.getAction())
                    .resourceType(request.getResourceType())
                    .resourceId(request.getResourceId())
                    .tenantId(tenantId != null ? tenantId.toString() : null)
                    .subject(request.getSubject())
                    .decision(request.getDecision())
                    .ipAddress(request.getIpAddress())
                    .userAgent(request.getUserAgent())
                    .metadata(metadata)
                    .build();
            String eventHash = hashChainEncoder.computeEventHash(fields, prevHash);

            AuditEvent event = AuditEvent.builder()
                    .tenantId(tenantId)
                    .action(request.getAction())
                    .resourceType(request.getResourceType())
                    .resourceId(request.getResourceId())
                    .subject(request.getSubject())
                    .decision(request.getDecision())
                    .ipAddress(request.getIpAddress())
                    .userAgent(request.getUserAgent())
                    .metadata(metadata)
                    .createdAt(Instant.now(clock))
                    .eventHash(eventHash)
                    .prevEventHash(prevHash)
                    .chainSequence(sequence)
                    .hashAlgorithm(HashChainEncoder.HASH_ALGORITHM)
                    .hashCanonicalization(HashChainEncoder.CANONICALIZATION)
                    .build();

            AuditEvent saved;
            try {
                saved = auditEventRepository.saveAndFlush(event);
            } catch (DataAccessException e) {
                log.error("Failed to persist audit event: scope={}, action={}, sequence={}",
                        ChainLocks.scope(tenantId), request.getAction(), sequence, e);
                throw new AuditPersistenceException("Failed to persist audit event for " + ChainLocks.scope(tenantId), e);
            }

            eventsRecordedCounter.increment();
            log.info("Audit event recorded: scope={}, sequence={}, action={}, resourceType={}, hash={}",
                    ChainLocks.scope(tenantId), sequence, request.getAction(), request.getResourceType(), eventHash);
            return saved;
        }
    }
}
