package com.dpp.audit.crypto;

import com.dpp.audit.exception.MalformedEventFieldException;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The hashed content of an audit event. Chain metadata (id, timestamps,
 * hashes, sequence) is deliberately not part of it.
 */
@Value
@Builder
public class EventFields {

    String action;
    String resourceType;
    String resourceId;
    String tenantId;
    String subject;
    String decision;
    String ipAddress;
    String userAgent;
    MetadataValue metadata;

    /**
     * Canonical object for hashing. Absent optional fields are omitted rather
     * than written as null; a top-level null metadata value counts as absent.
     */
    public MetadataValue.ObjectValue toCanonicalObject() {
        if (action == null) {
            throw new MalformedEventFieldException("action is required");
        }
        if (resourceType == null) {
            throw new MalformedEventFieldException("resource_type is required");
        }

        Map<String, MetadataValue> fields = new LinkedHashMap<>();
        fields.put("action", MetadataValue.text(action));
        fields.put("resource_type", MetadataValue.text(resourceType));
        putIfPresent(fields, "resource_id", resourceId);
        putIfPresent(fields, "tenant_id", tenantId);
        putIfPresent(fields, "subject", subject);
        putIfPresent(fields, "decision", decision);
        putIfPresent(fields, "ip_address", ipAddress);
        putIfPresent(fields, "user_agent", userAgent);
        if (metadata != null && !(metadata instanceof MetadataValue.NullValue)) {
            fields.put("metadata", metadata);
        }
        return MetadataValue.object(fields);
    }

    private static void putIfPresent(Map<String, MetadataValue> fields, String key, String value) {
        if (value != null) {
            fields.put(key, MetadataValue.text(value));
        }
    }
}
