package com.dpp.common.distributed;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InProcessLockService")
class InProcessLockServiceTest {

    private final InProcessLockService lockService = new InProcessLockService(Duration.ofMillis(200));

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Nested
    @DisplayName("Outside a transaction")
    class WithoutTransaction {

        @Test
        @DisplayName("Should release the lock when the handle is closed")
        void shouldReleaseOnClose() {
            try (DistributedLock lock = lockService.acquire("audit-chain:t1")) {
                assertThat(lock.isTransactionBound()).isFalse();
                assertThat(lockService.isLocked("audit-chain:t1")).isTrue();
            }

            assertThat(lockService.isLocked("audit-chain:t1")).isFalse();
        }

        @Test
        @DisplayName("Should time out while another thread holds the same name")
        void shouldTimeOutWhenHeldElsewhere() throws Exception {
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                executor.submit(() -> {
                    try (DistributedLock ignored = lockService.acquire("audit-chain:t2")) {
                        held.countDown();
                        done.await(5, TimeUnit.SECONDS);
                    }
                    return null;
                });
                assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

                assertThatThrownBy(() -> lockService.acquire("audit-chain:t2"))
                        .isInstanceOf(LockTimeoutException.class)
                        .extracting("lockName").isEqualTo("audit-chain:t2");
            } finally {
                done.countDown();
                executor.shutdown();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        }

        @Test
        @DisplayName("Should not block unrelated lock names")
        void shouldNotBlockOtherNames() {
            try (DistributedLock first = lockService.acquire("audit-chain:a");
                 DistributedLock second = lockService.acquire("audit-chain:b")) {
                assertThat(first.getLockName()).isEqualTo("audit-chain:a");
                assertThat(second.getLockName()).isEqualTo("audit-chain:b");
            }
        }

        @Test
        @DisplayName("Should serialize concurrent critical sections on one name")
        void shouldSerializeCriticalSections() throws Exception {
            InProcessLockService patient = new InProcessLockService(Duration.ofSeconds(10));
            AtomicInteger inside = new AtomicInteger();
            AtomicInteger maxInside = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(6);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                futures.add(executor.submit(() -> {
                    try (DistributedLock ignored = patient.acquire("audit-chain:shared")) {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.sleep(2);
                        inside.decrementAndGet();
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertThat(maxInside.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Inside a transaction")
    class WithTransaction {

        @Test
        @DisplayName("Should keep the lock until transaction completion")
        void shouldHoldUntilCompletion() {
            TransactionSynchronizationManager.initSynchronization();

            DistributedLock lock = lockService.acquire("audit-chain:tx");
            lock.close();

            assertThat(lock.isTransactionBound()).isTrue();
            assertThat(lock.isReleased()).isFalse();
            assertThat(lockService.isLocked("audit-chain:tx")).isTrue();

            for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
                synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
            }

            assertThat(lock.isReleased()).isTrue();
            assertThat(lockService.isLocked("audit-chain:tx")).isFalse();
        }
    }
}
