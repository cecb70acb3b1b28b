package com.dpp.audit.service;

import com.dpp.audit.config.AuditProperties;
import com.dpp.audit.domain.MerkleRoot;
import com.dpp.audit.exception.AuditServiceException;
import com.dpp.audit.exception.NothingToAnchorException;
import com.dpp.audit.repository.AuditEventRepository;
import com.dpp.common.distributed.LockTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Periodically anchors pending events of every chain scope. Each batch runs in
 * its own transaction through {@link MerkleAnchorJob}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "audit.anchor", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class AnchorScheduler {

    private final MerkleAnchorJob merkleAnchorJob;
    private final AuditEventRepository auditEventRepository;
    private final AuditProperties auditProperties;

    @Scheduled(fixedDelayString = "${audit.anchor.fixed-delay-ms:900000}",
            initialDelayString = "${audit.anchor.fixed-delay-ms:900000}")
    public void anchorAllScopes() {
        List<UUID> scopes = auditEventRepository.findChainScopes();
        int anchored = 0;
        for (UUID tenantId : scopes) {
            try {
                anchored += anchorPending(tenantId).size();
            } catch (LockTimeoutException e) {
                log.warn("Skipping anchor run for scope {}: another anchor job holds the lock", ChainLocks.scope(tenantId));
            } catch (AuditServiceException e) {
                log.error("Anchoring failed for scope {} [{}]: {}", ChainLocks.scope(tenantId), e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error anchoring scope {}", ChainLocks.scope(tenantId), e);
            }
        }
        log.info("Anchor run finished: scopes={}, anchorsCreated={}", scopes.size(), anchored);
    }

    /**
     * Anchors batches for one scope until it is fully anchored or the per-run
     * batch limit is reached.
     */
    public List<MerkleRoot> anchorPending(UUID tenantId) {
        List<MerkleRoot> created = new ArrayList<>();
        int maxBatches = auditProperties.getAnchor().getMaxBatchesPerRun();
        while (created.size() < maxBatches) {
            try {
                created.add(merkleAnchorJob.anchorBatch(tenantId));
            } catch (NothingToAnchorException e) {
                log.debug("Scope {} fully anchored", ChainLocks.scope(tenantId));
                break;
            }
        }
        if (created.size() == maxBatches) {
            log.info("Scope {} reached the per-run limit of {} batches, remaining events wait for the next run",
                    ChainLocks.scope(tenantId), maxBatches);
        }
        return created;
    }
}
