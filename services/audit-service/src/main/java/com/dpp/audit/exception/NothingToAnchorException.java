package com.dpp.audit.exception;

import java.util.UUID;

/**
 * No unanchored events exist for the chain scope.
 */
public class NothingToAnchorException extends AuditServiceException {

    private final UUID tenantId;

    public NothingToAnchorException(UUID tenantId) {
        super("No unanchored audit events for " + (tenantId != null ? "tenant " + tenantId : "platform scope"),
                "NOTHING_TO_ANCHOR");
        this.tenantId = tenantId;
    }

    public UUID getTenantId() {
        return tenantId;
    }
}
