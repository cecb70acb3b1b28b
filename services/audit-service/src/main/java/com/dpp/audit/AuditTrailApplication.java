package com.dpp.audit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Audit Trail Service
 *
 * Tamper-evident audit log of the DPP platform:
 * - per-tenant SHA-256 hash chains of audited actions
 * - periodic Merkle anchoring of unanchored events
 * - Ed25519 signed roots with optional RFC 3161 timestamps
 * - read-only chain and inclusion proof verification
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
public class AuditTrailApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditTrailApplication.class, args);
    }
}
