package com.dpp.audit.service;

import com.dpp.audit.TestChains;
import com.dpp.audit.config.AuditProperties;
import com.dpp.audit.crypto.MerkleRootSigner;
import com.dpp.audit.crypto.MerkleTree;
import com.dpp.audit.domain.AuditEvent;
import com.dpp.audit.domain.MerkleRoot;
import com.dpp.audit.exception.AnchorSigningException;
import com.dpp.audit.exception.AuditPersistenceException;
import com.dpp.audit.exception.AuditServiceException;
import com.dpp.audit.exception.NothingToAnchorException;
import com.dpp.audit.repository.AuditEventRepository;
import com.dpp.audit.repository.MerkleRootRepository;
import com.dpp.audit.timestamp.TimestampAuthorityClient;
import com.dpp.audit.timestamp.TimestampResult;
import com.dpp.common.distributed.InProcessLockService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MerkleAnchorJob")
class MerkleAnchorJobTest {

    private static final UUID TENANT = UUID.fromString("c3d4e5f6-a7b8-4c9d-8e0f-112233445566");
    private static final Instant NOW = Instant.parse("2026-05-05T05:05:05Z");
    private static final int BATCH_SIZE = 3;

    @Mock
    private AuditEventRepository auditEventRepository;
    @Mock
    private MerkleRootRepository merkleRootRepository;
    @Mock
    private MerkleRootSigner merkleRootSigner;
    @Mock
    private TimestampAuthorityClient timestampAuthorityClient;

    private SimpleMeterRegistry meterRegistry;
    private MerkleAnchorJob job;
    private List<AuditEvent> chain;

    @BeforeEach
    void setUp() {
        AuditProperties properties = new AuditProperties();
        properties.getAnchor().setBatchSize(BATCH_SIZE);
        meterRegistry = new SimpleMeterRegistry();
        job = new MerkleAnchorJob(auditEventRepository, merkleRootRepository, merkleRootSigner,
                timestampAuthorityClient, new InProcessLockService(Duration.ofSeconds(1)), properties,
                Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
        chain = TestChains.chain(TENANT, 5);
    }

    private static List<String> hashes(List<AuditEvent> events) {
        return events.stream().map(AuditEvent::getEventHash).collect(Collectors.toList());
    }

    private void givenUnanchored(long lastAnchored, List<AuditEvent> selection) {
        if (lastAnchored < 0) {
            when(merkleRootRepository.findLatestAnchor(TENANT)).thenReturn(Optional.empty());
        } else {
            when(merkleRootRepository.findLatestAnchor(TENANT)).thenReturn(Optional.of(MerkleRoot.builder()
                    .tenantId(TENANT)
                    .firstSequence(0)
                    .lastSequence(lastAnchored)
                    .eventCount((int) lastAnchored + 1)
                    .build()));
        }
        when(auditEventRepository.findChainAfter(TENANT, lastAnchored, PageRequest.of(0, BATCH_SIZE)))
                .thenReturn(selection);
    }

    private void givenSignedAndSaved(TimestampResult timestamp) {
        when(merkleRootSigner.sign(anyString())).thenReturn("c2lnbmF0dXJl");
        when(merkleRootSigner.getKeyId()).thenReturn("anchor-key-1");
        when(timestampAuthorityClient.requestTimestamp(anyString())).thenReturn(timestamp);
        when(merkleRootRepository.saveAndFlush(any(MerkleRoot.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("First anchor starts at sequence 0 and covers at most one batch")
    void firstAnchor() {
        List<AuditEvent> selection = chain.subList(0, 3);
        givenUnanchored(-1, selection);
        givenSignedAndSaved(TimestampResult.skipped());

        MerkleRoot root = job.anchorBatch(TENANT);

        assertThat(root.getFirstSequence()).isZero();
        assertThat(root.getLastSequence()).isEqualTo(2);
        assertThat(root.getEventCount()).isEqualTo(3);
        assertThat(root.getRootHash()).isEqualTo(MerkleTree.computeRoot(hashes(selection)));
        assertThat(root.getSignature()).isEqualTo("c2lnbmF0dXJl");
        assertThat(root.getSignatureKid()).isEqualTo("anchor-key-1");
        assertThat(root.getSignatureAlgorithm()).isEqualTo("Ed25519");
        assertThat(root.getTsaToken()).isNull();
        assertThat(root.getCreatedAt()).isEqualTo(NOW);
        verify(merkleRootSigner).sign(root.getRootHash());
        assertThat(meterRegistry.get("audit.anchors.created").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Next anchor continues right after the previous range")
    void contiguousAnchor() {
        givenUnanchored(2, chain.subList(3, 5));
        givenSignedAndSaved(TimestampResult.skipped());

        MerkleRoot root = job.anchorBatch(TENANT);

        assertThat(root.getFirstSequence()).isEqualTo(3);
        assertThat(root.getLastSequence()).isEqualTo(4);
        assertThat(root.getEventCount()).isEqualTo((int) (root.getLastSequence() - root.getFirstSequence() + 1));
    }

    @Test
    @DisplayName("Should refuse to anchor when nothing is new")
    void nothingToAnchor() {
        givenUnanchored(4, List.of());

        assertThatThrownBy(() -> job.anchorBatch(TENANT))
                .isInstanceOf(NothingToAnchorException.class);

        verify(merkleRootSigner, never()).sign(anyString());
        verify(merkleRootRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Should persist nothing when signing fails")
    void signingFailsClosed() {
        givenUnanchored(-1, chain.subList(0, 3));
        when(merkleRootSigner.sign(anyString())).thenThrow(new AnchorSigningException("No Merkle root signing key configured"));

        assertThatThrownBy(() -> job.anchorBatch(TENANT))
                .isInstanceOf(AnchorSigningException.class);

        verify(timestampAuthorityClient, never()).requestTimestamp(anyString());
        verify(merkleRootRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Should still anchor when the timestamp authority fails")
    void timestampFailureIsSoft() {
        givenUnanchored(-1, chain.subList(0, 3));
        givenSignedAndSaved(TimestampResult.failed("timestamp authority unreachable: timeout"));

        MerkleRoot root = job.anchorBatch(TENANT);

        assertThat(root.getTsaToken()).isNull();
        assertThat(root.getTimestampHashAlgorithm()).isNull();
        assertThat(meterRegistry.get("audit.anchors.timestamp.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should store a granted timestamp token")
    void timestampGranted() {
        givenUnanchored(-1, chain.subList(0, 3));
        givenSignedAndSaved(TimestampResult.granted(new byte[] {1, 2, 3}));

        MerkleRoot root = job.anchorBatch(TENANT);

        assertThat(root.getTsaToken()).containsExactly(1, 2, 3);
        assertThat(root.getTimestampHashAlgorithm()).isEqualTo("sha-256");
    }

    @Test
    @DisplayName("Should refuse a selection with a sequence gap")
    void sequenceGap() {
        givenUnanchored(-1, List.of(chain.get(0), chain.get(2)));

        assertThatThrownBy(() -> job.anchorBatch(TENANT))
                .isInstanceOf(AuditServiceException.class)
                .extracting("errorCode").isEqualTo("CHAIN_SEQUENCE_GAP");

        verify(merkleRootRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Should wrap storage failures")
    void persistenceFailure() {
        givenUnanchored(-1, chain.subList(0, 3));
        when(merkleRootSigner.sign(anyString())).thenReturn("c2lnbmF0dXJl");
        when(timestampAuthorityClient.requestTimestamp(anyString())).thenReturn(TimestampResult.skipped());
        when(merkleRootRepository.saveAndFlush(any(MerkleRoot.class))).thenThrow(new QueryTimeoutException("slow"));

        assertThatThrownBy(() -> job.anchorBatch(TENANT))
                .isInstanceOf(AuditPersistenceException.class);
        assertThat(meterRegistry.get("audit.anchors.created").counter().count()).isZero();
    }

    @Test
    @DisplayName("Non-positive batch size anchors one event at a time")
    void clampsBatchSize() {
        AuditProperties properties = new AuditProperties();
        properties.getAnchor().setBatchSize(0);
        MerkleAnchorJob singleEventJob = new MerkleAnchorJob(auditEventRepository, merkleRootRepository,
                merkleRootSigner, timestampAuthorityClient, new InProcessLockService(Duration.ofSeconds(1)),
                properties, Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
        when(merkleRootRepository.findLatestAnchor(TENANT)).thenReturn(Optional.empty());
        when(auditEventRepository.findChainAfter(TENANT, -1L, PageRequest.of(0, 1))).thenReturn(chain.subList(0, 1));
        givenSignedAndSaved(TimestampResult.skipped());

        MerkleRoot root = singleEventJob.anchorBatch(TENANT);

        assertThat(root.getEventCount()).isEqualTo(1);
        assertThat(root.getRootHash()).isEqualTo(chain.get(0).getEventHash());
    }
}
