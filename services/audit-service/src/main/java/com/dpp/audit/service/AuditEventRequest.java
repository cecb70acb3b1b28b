package com.dpp.audit.service;

import com.dpp.audit.crypto.MetadataValue;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * What the calling business action wants audited. It never carries hashes or
 * sequence numbers; those are assigned by {@link AuditEventWriter}.
 */
@Value
@Builder
public class AuditEventRequest {

    /** {@code null} records into the platform chain. */
    UUID tenantId;
    String action;
    String resourceType;
    String resourceId;
    String subject;
    String decision;
    String ipAddress;
    String userAgent;
    MetadataValue metadata;
}
