package com.dpp.audit.config;

import com.dpp.common.distributed.InProcessLockService;
import com.dpp.common.distributed.PostgresAdvisoryLockService;
import com.dpp.common.distributed.TransactionScopedLockService;
import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.orm.jpa.SharedEntityManagerCreator;

/**
 * Named lock used to serialize chain appends and anchoring per chain scope.
 * PostgreSQL advisory locks work across service instances; the in-process
 * variant only serializes threads of a single JVM.
 */
@Slf4j
@Configuration
public class ChainLockConfig {

    @Bean
    @ConditionalOnProperty(prefix = "audit.chain", name = "lock-mode", havingValue = "advisory", matchIfMissing = true)
    public TransactionScopedLockService advisoryChainLockService(EntityManagerFactory entityManagerFactory,
                                                                 AuditProperties auditProperties) {
        log.info("Audit chain locking via PostgreSQL advisory locks, wait={}", auditProperties.getChain().getLockWait());
        return new PostgresAdvisoryLockService(
                SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory),
                auditProperties.getChain().getLockWait());
    }

    @Bean
    @ConditionalOnProperty(prefix = "audit.chain", name = "lock-mode", havingValue = "in-process")
    public TransactionScopedLockService inProcessChainLockService(AuditProperties auditProperties) {
        log.warn("Audit chain locking is in-process only; do not run more than one instance against the same database");
        return new InProcessLockService(auditProperties.getChain().getLockWait());
    }
}
