package com.dpp.audit.repository;

import com.dpp.audit.config.AuditProperties;
import com.dpp.audit.config.ChainLockConfig;
import com.dpp.audit.config.ClockConfig;
import com.dpp.audit.crypto.ChainVerifier;
import com.dpp.audit.crypto.HashChainEncoder;
import com.dpp.audit.crypto.MerkleRootSigner;
import com.dpp.audit.crypto.MetadataValue;
import com.dpp.audit.domain.AuditEvent;
import com.dpp.audit.domain.MerkleRoot;
import com.dpp.audit.dto.ChainVerificationResponse;
import com.dpp.audit.dto.InclusionProofResponse;
import com.dpp.audit.exception.NothingToAnchorException;
import com.dpp.audit.service.AuditEventRequest;
import com.dpp.audit.service.AuditEventWriter;
import com.dpp.audit.service.AuditIntegrityService;
import com.dpp.audit.service.MerkleAnchorJob;
import com.dpp.audit.timestamp.TimestampAuthorityClient;
import com.dpp.audit.timestamp.TimestampResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Writer, anchor job and integrity checks against a real schema. Each test uses
 * its own tenant because the tables are append-only.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        ChainLockConfig.class,
        ClockConfig.class,
        HashChainEncoder.class,
        ChainVerifier.class,
        AuditEventWriter.class,
        MerkleAnchorJob.class,
        AuditIntegrityService.class,
        AuditTrailPersistenceTest.TestConfig.class
})
@DisplayName("Audit trail persistence")
class AuditTrailPersistenceTest {

    @TestConfiguration
    @EnableConfigurationProperties
    @Import(AuditProperties.class)
    static class TestConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private AuditEventWriter writer;
    @Autowired
    private MerkleAnchorJob anchorJob;
    @Autowired
    private AuditIntegrityService integrityService;
    @Autowired
    private AuditEventRepository auditEventRepository;
    @Autowired
    private MerkleRootRepository merkleRootRepository;

    @MockBean
    private MerkleRootSigner merkleRootSigner;
    @MockBean
    private TimestampAuthorityClient timestampAuthorityClient;

    private UUID tenantId;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
    }

    private AuditEvent record(UUID tenant, int i) {
        return writer.recordEvent(AuditEventRequest.builder()
                .tenantId(tenant)
                .action("passport.update")
                .resourceType("passport")
                .resourceId("passport-" + i)
                .subject("editor@example.com")
                .ipAddress("192.0.2.10")
                .metadata(MetadataValue.from(Map.of("revision", i, "note", "line\nbreak", "tags", List.of("a", "b"))))
                .build());
    }

    @Test
    @DisplayName("Recorded events form a chain that verifies after reloading")
    void recordedChainVerifies() {
        for (int i = 0; i < 5; i++) {
            record(tenantId, i);
        }

        List<AuditEvent> stored = auditEventRepository.findChain(tenantId);
        ChainVerificationResponse verification = integrityService.verifyChain(tenantId);

        assertThat(stored).extracting(AuditEvent::getChainSequence).containsExactly(0L, 1L, 2L, 3L, 4L);
        assertThat(stored.get(0).getPrevEventHash()).isEqualTo(HashChainEncoder.GENESIS_HASH);
        assertThat(stored.get(2).getMetadata())
                .isEqualTo(MetadataValue.from(Map.of("revision", 2, "note", "line\nbreak", "tags", List.of("a", "b"))));
        assertThat(verification.isValid()).isTrue();
        assertThat(verification.getVerifiedCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Tenant and platform chains are sequenced independently")
    void independentScopes() {
        long platformBefore = auditEventRepository.findChainHead(null).map(AuditEvent::getChainSequence).orElse(-1L);
        UUID otherTenant = UUID.randomUUID();

        record(tenantId, 0);
        record(null, 0);
        AuditEvent second = record(tenantId, 1);
        AuditEvent other = record(otherTenant, 0);
        AuditEvent platform = record(null, 1);

        assertThat(second.getChainSequence()).isEqualTo(1);
        assertThat(other.getChainSequence()).isZero();
        assertThat(platform.getChainSequence()).isEqualTo(platformBefore + 2);
        assertThat(platform.getTenantId()).isNull();
        assertThat(integrityService.verifyChain(null).isValid()).isTrue();
        assertThat(auditEventRepository.findChainScopes()).contains(tenantId, otherTenant, null);
    }

    @Test
    @DisplayName("Concurrent writers produce a gap-free chain")
    void concurrentWritersOnDatabase() throws Exception {
        int threads = 4;
        int perThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int offset = t * perThread;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    record(tenantId, offset + i);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        List<AuditEvent> stored = auditEventRepository.findChain(tenantId);
        assertThat(stored).hasSize(threads * perThread);
        for (int i = 0; i < stored.size(); i++) {
            assertThat(stored.get(i).getChainSequence()).isEqualTo(i);
        }
        assertThat(integrityService.verifyChain(tenantId).isValid()).isTrue();
    }

    @Test
    @DisplayName("Anchoring covers contiguous ranges and then reports nothing to anchor")
    void anchoringRanges() {
        when(merkleRootSigner.sign(anyString())).thenReturn("c2lnbmF0dXJl");
        when(merkleRootSigner.getKeyId()).thenReturn("anchor-key-1");
        when(timestampAuthorityClient.requestTimestamp(anyString())).thenReturn(TimestampResult.skipped());
        List<AuditEvent> events = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            events.add(record(tenantId, i));
        }

        MerkleRoot first = anchorJob.anchorBatch(tenantId);
        MerkleRoot second = anchorJob.anchorBatch(tenantId);

        assertThat(first.getFirstSequence()).isZero();
        assertThat(first.getLastSequence()).isEqualTo(3);
        assertThat(first.getEventCount()).isEqualTo(4);
        assertThat(second.getFirstSequence()).isEqualTo(4);
        assertThat(second.getLastSequence()).isEqualTo(5);
        assertThat(second.getEventCount()).isEqualTo(2);
        assertThatThrownBy(() -> anchorJob.anchorBatch(tenantId))
                .isInstanceOf(NothingToAnchorException.class);
        assertThat(merkleRootRepository.findAnchors(tenantId)).hasSize(2);

        InclusionProofResponse proof = integrityService.inclusionProof(events.get(5).getId());
        assertThat(proof.getAnchorId()).isEqualTo(second.getId());
        assertThat(proof.getLeafIndex()).isEqualTo(1);
        assertThat(proof.isVerified()).isTrue();
    }

    @Test
    @DisplayName("Schema rejects a second event with the same sequence")
    void uniqueSequencePerTenant() {
        AuditEvent original = record(tenantId, 0);
        AuditEvent duplicate = original.toBuilder().id(null).resourceId("other").build();

        assertThatThrownBy(() -> auditEventRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
