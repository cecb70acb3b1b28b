package com.dpp.audit.service;

import com.dpp.audit.config.AuditProperties;
import com.dpp.audit.crypto.MerkleRootSigner;
import com.dpp.audit.crypto.MerkleTree;
import com.dpp.audit.domain.AuditEvent;
import com.dpp.audit.domain.MerkleRoot;
import com.dpp.audit.exception.AuditPersistenceException;
import com.dpp.audit.exception.AuditServiceException;
import com.dpp.audit.exception.NothingToAnchorException;
import com.dpp.audit.repository.AuditEventRepository;
import com.dpp.audit.repository.MerkleRootRepository;
import com.dpp.audit.timestamp.TimestampAuthorityClient;
import com.dpp.audit.timestamp.TimestampResult;
import com.dpp.common.distributed.DistributedLock;
import com.dpp.common.distributed.TransactionScopedLockService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Seals the next range of unanchored events of a chain scope under a signed
 * Merkle root.
 *
 * <p>Ranges start right after the last anchored sequence, so successive
 * anchors are contiguous and never overlap. Signing is mandatory; the RFC 3161
 * timestamp is best effort and its absence only shows as a missing token.
 */
@Slf4j
@Service
public class MerkleAnchorJob {

    private final AuditEventRepository auditEventRepository;
    private final MerkleRootRepository merkleRootRepository;
    private final MerkleRootSigner merkleRootSigner;
    private final TimestampAuthorityClient timestampAuthorityClient;
    private final TransactionScopedLockService lockService;
    private final AuditProperties auditProperties;
    private final Clock clock;

    private final Counter anchorsCreatedCounter;
    private final Counter timestampFailureCounter;

    public MerkleAnchorJob(AuditEventRepository auditEventRepository,
                           MerkleRootRepository merkleRootRepository,
                           MerkleRootSigner merkleRootSigner,
                           TimestampAuthorityClient timestampAuthorityClient,
                           TransactionScopedLockService lockService,
                           AuditProperties auditProperties,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.auditEventRepository = auditEventRepository;
        this.merkleRootRepository = merkleRootRepository;
        this.merkleRootSigner = merkleRootSigner;
        this.timestampAuthorityClient = timestampAuthorityClient;
        this.lockService = lockService;
        this.auditProperties = auditProperties;
        this.clock = clock;

        this.anchorsCreatedCounter = Counter.builder("audit.anchors.created")
                .description("Merkle roots persisted")
                .register(meterRegistry);
        this.timestampFailureCounter = Counter.builder("audit.anchors.timestamp.failures")
                .description("Anchors persisted without a timestamp token because the authority failed")
                .register(meterRegistry);
    }

    /**
     * @throws NothingToAnchorException when every event of the scope is already anchored
     * @throws com.dpp.audit.exception.AnchorSigningException when the root cannot be signed;
     *         nothing is persisted
     */
    @Transactional
    public MerkleRoot anchorBatch(UUID tenantId) {
        try (DistributedLock lock = lockService.acquire(ChainLocks.anchorLock(tenantId))) {
            long lastAnchored = merkleRootRepository.findLatestAnchor(tenantId)
                    .map(MerkleRoot::getLastSequence)
                    .orElse(-1L);

            int batchSize = Math.max(1, auditProperties.getAnchor().getBatchSize());
            List<AuditEvent> events = auditEventRepository.findChainAfter(
                    tenantId, lastAnchored, PageRequest.of(0, batchSize));
            if (events.isEmpty()) {
                throw new NothingToAnchorException(tenantId);
            }
            requireContiguous(tenantId, events, lastAnchored + 1);

            List<String> leaves = new ArrayList<>(events.size());
            for (AuditEvent event : events) {
                leaves.add(event.getEventHash());
            }
            String rootHash = MerkleTree.computeRoot(leaves);
            String signature = merkleRootSigner.sign(rootHash);

            TimestampResult timestamp = timestampAuthorityClient.requestTimestamp(rootHash);
            if (timestamp.getStatus() == TimestampResult.Status.FAILED) {
                timestampFailureCounter.increment();
            }

            long firstSequence = events.get(0).getChainSequence();
            long lastSequence = events.get(events.size() - 1).getChainSequence();
            MerkleRoot merkleRoot = MerkleRoot.builder()
                    .tenantId(tenantId)
                    .rootHash(rootHash)
                    .eventCount(events.size())
                    .firstSequence(firstSequence)
                    .lastSequence(lastSequence)
                    .signature(signature)
                    .signatureKid(merkleRootSigner.getKeyId())
                    .signatureAlgorithm(MerkleRootSigner.ALGORITHM)
                    .tsaToken(timestamp.isGranted() ? timestamp.getToken() : null)
                    .timestampHashAlgorithm(timestamp.isGranted() ? TimestampAuthorityClient.HASH_ALGORITHM : null)
                    .createdAt(Instant.now(clock))
                    .build();

            MerkleRoot saved;
            try {
                saved = merkleRootRepository.saveAndFlush(merkleRoot);
            } catch (DataAccessException e) {
                log.error("Failed to persist Merkle root for scope={} range=[{}, {}]",
                        ChainLocks.scope(tenantId), firstSequence, lastSequence, e);
                throw new AuditPersistenceException("Failed to persist Merkle root for " + ChainLocks.scope(tenantId), e);
            }

            anchorsCreatedCounter.increment();
            log.info("Anchored audit events: scope={}, range=[{}, {}], count={}, root={}, timestamp={}",
                    ChainLocks.scope(tenantId), firstSequence, lastSequence, events.size(), rootHash,
                    timestamp.getStatus());
            return saved;
        }
    }

    private static void requireContiguous(UUID tenantId, List<AuditEvent> events, long expectedFirst) {
        long expected = expectedFirst;
        for (AuditEvent event : events) {
            if (event.getChainSequence() != expected) {
                throw new AuditServiceException(String.format(
                        "Chain %s has a sequence gap: expected %d but found %d",
                        ChainLocks.scope(tenantId), expected, event.getChainSequence()), "CHAIN_SEQUENCE_GAP");
            }
            expected++;
        }
    }
}
