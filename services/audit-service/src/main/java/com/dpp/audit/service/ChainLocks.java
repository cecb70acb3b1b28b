package com.dpp.audit.service;

import java.util.UUID;

/**
 * Lock names per chain scope. Appends and anchoring use separate locks so an
 * anchor run never blocks writers.
 */
final class ChainLocks {

    static final String PLATFORM_SCOPE = "platform";

    private ChainLocks() {
    }

    static String chainLock(UUID tenantId) {
        return "audit-chain:" + scope(tenantId);
    }

    static String anchorLock(UUID tenantId) {
        return "audit-anchor:" + scope(tenantId);
    }

    static String scope(UUID tenantId) {
        return tenantId != null ? tenantId.toString() : PLATFORM_SCOPE;
    }
}
