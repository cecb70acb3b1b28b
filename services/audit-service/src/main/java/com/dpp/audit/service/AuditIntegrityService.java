package com.dpp.audit.service;

import com.dpp.audit.crypto.ChainVerificationResult;
import com.dpp.audit.crypto.ChainVerifier;
import com.dpp.audit.crypto.HashChainEncoder;
import com.dpp.audit.crypto.MerkleRootSigner;
import com.dpp.audit.crypto.MerkleTree;
import com.dpp.audit.crypto.ProofStep;
import com.dpp.audit.domain.AuditEvent;
import com.dpp.audit.domain.MerkleRoot;
import com.dpp.audit.dto.ChainVerificationResponse;
import com.dpp.audit.dto.EventVerificationResponse;
import com.dpp.audit.dto.InclusionProofResponse;
import com.dpp.audit.dto.SignatureVerificationResponse;
import com.dpp.audit.exception.AuditRecordNotFoundException;
import com.dpp.audit.repository.AuditEventRepository;
import com.dpp.audit.repository.MerkleRootRepository;
import com.dpp.audit.timestamp.TimestampAuthorityClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read-only integrity checks for compliance tooling. Broken chains and bad
 * proofs are reported in the responses and never repaired.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class AuditIntegrityService {

    private final AuditEventRepository auditEventRepository;
    private final MerkleRootRepository merkleRootRepository;
    private final ChainVerifier chainVerifier;
    private final MerkleRootSigner merkleRootSigner;
    private final TimestampAuthorityClient timestampAuthorityClient;
    private final Clock clock;

    private final Counter verificationBreakCounter;

    public AuditIntegrityService(AuditEventRepository auditEventRepository,
                                 MerkleRootRepository merkleRootRepository,
                                 ChainVerifier chainVerifier,
                                 MerkleRootSigner merkleRootSigner,
                                 TimestampAuthorityClient timestampAuthorityClient,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.auditEventRepository = auditEventRepository;
        this.merkleRootRepository = merkleRootRepository;
        this.chainVerifier = chainVerifier;
        this.merkleRootSigner = merkleRootSigner;
        this.timestampAuthorityClient = timestampAuthorityClient;
        this.clock = clock;

        this.verificationBreakCounter = Counter.builder("audit.chain.verification.breaks")
                .description("Chain verifications that found a break")
                .register(meterRegistry);
    }

    public ChainVerificationResponse verifyChain(UUID tenantId) {
        List<AuditEvent> chain = auditEventRepository.findChain(tenantId);
        ChainVerificationResult result = chainVerifier.verifyHashChain(chain);
        if (!result.isValid()) {
            verificationBreakCounter.increment();
            log.warn("Audit chain of scope {} is broken at index {} after {} intact events",
                    ChainLocks.scope(tenantId), result.getFirstBreakAt(), result.getVerifiedCount());
        }
        return ChainVerificationResponse.builder()
                .tenantId(tenantId)
                .valid(result.isValid())
                .verifiedCount(result.getVerifiedCount())
                .firstBreakAt(result.getFirstBreakAt())
                .errors(result.getErrors())
                .verifiedAt(Instant.now(clock))
                .build();
    }

    /**
     * Verifies one event against its actual predecessor in the chain.
     */
    public EventVerificationResponse verifyEvent(UUID eventId) {
        AuditEvent event = findEvent(eventId);

        String expectedPrev = HashChainEncoder.GENESIS_HASH;
        if (event.getChainSequence() > 0) {
            List<AuditEvent> predecessor = auditEventRepository.findChainRange(
                    event.getTenantId(), event.getChainSequence() - 1, event.getChainSequence() - 1);
            // without a predecessor the event can only be checked against its own link
            expectedPrev = predecessor.isEmpty() ? null : predecessor.get(0).getEventHash();
        }

        boolean linked = expectedPrev != null && expectedPrev.equals(event.getPrevEventHash());
        boolean hashValid = chainVerifier.verifyEvent(event,
                expectedPrev != null ? expectedPrev : event.getPrevEventHash());

        return EventVerificationResponse.builder()
                .eventId(event.getId())
                .tenantId(event.getTenantId())
                .chainSequence(event.getChainSequence())
                .hashValid(hashValid)
                .linked(linked)
                .eventHash(event.getEventHash())
                .prevEventHash(event.getPrevEventHash())
                .verifiedAt(Instant.now(clock))
                .build();
    }

    public InclusionProofResponse inclusionProof(UUID eventId) {
        AuditEvent event = findEvent(eventId);
        MerkleRoot anchor = merkleRootRepository.findCoveringAnchor(event.getTenantId(), event.getChainSequence())
                .orElseThrow(() -> new AuditRecordNotFoundException("Anchor covering audit event", eventId));

        List<String> leaves = leavesOf(anchor);
        int leafIndex = (int) (event.getChainSequence() - anchor.getFirstSequence());
        List<ProofStep> proof = MerkleTree.computeInclusionProof(leaves, leafIndex);

        return InclusionProofResponse.builder()
                .eventId(event.getId())
                .anchorId(anchor.getId())
                .chainSequence(event.getChainSequence())
                .leafIndex(leafIndex)
                .leafHash(event.getEventHash())
                .rootHash(anchor.getRootHash())
                .proof(proof)
                .verified(MerkleTree.verifyInclusionProof(event.getEventHash(), proof, anchor.getRootHash()))
                .build();
    }

    public SignatureVerificationResponse verifyAnchor(UUID anchorId) {
        MerkleRoot anchor = merkleRootRepository.findById(anchorId)
                .orElseThrow(() -> new AuditRecordNotFoundException("Merkle root", anchorId));

        Boolean signatureValid = merkleRootSigner.canVerify()
                ? merkleRootSigner.verify(anchor.getRootHash(), anchor.getSignature())
                : null;

        List<String> leaves = leavesOf(anchor);
        boolean rootMatches = leaves.size() == anchor.getEventCount()
                && !leaves.isEmpty()
                && MerkleTree.computeRoot(leaves).equals(anchor.getRootHash());

        boolean timestamped = anchor.getTsaToken() != null;
        Boolean timestampValid = timestamped
                ? timestampAuthorityClient.verifyTimestamp(anchor.getTsaToken(), anchor.getRootHash())
                : null;

        if (Boolean.FALSE.equals(signatureValid) || !rootMatches || Boolean.FALSE.equals(timestampValid)) {
            log.warn("Merkle root {} failed verification: signatureValid={}, rootMatchesEvents={}, timestampValid={}",
                    anchorId, signatureValid, rootMatches, timestampValid);
        }

        return SignatureVerificationResponse.builder()
                .anchorId(anchor.getId())
                .rootHash(anchor.getRootHash())
                .signatureKid(anchor.getSignatureKid())
                .signatureValid(signatureValid)
                .rootMatchesEvents(rootMatches)
                .timestamped(timestamped)
                .timestampValid(timestampValid)
                .build();
    }

    public List<MerkleRoot> listAnchors(UUID tenantId) {
        return merkleRootRepository.findAnchors(tenantId);
    }

    private AuditEvent findEvent(UUID eventId) {
        return auditEventRepository.findById(eventId)
                .orElseThrow(() -> new AuditRecordNotFoundException("Audit event", eventId));
    }

    private List<String> leavesOf(MerkleRoot anchor) {
        List<AuditEvent> covered = auditEventRepository.findChainRange(
                anchor.getTenantId(), anchor.getFirstSequence(), anchor.getLastSequence());
        List<String> leaves = new ArrayList<>(covered.size());
        for (AuditEvent event : covered) {
            leaves.add(event.getEventHash());
        }
        return leaves;
    }
}
