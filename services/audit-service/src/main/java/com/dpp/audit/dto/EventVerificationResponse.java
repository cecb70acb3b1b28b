package com.dpp.audit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventVerificationResponse {
    private UUID eventId;
    private UUID tenantId;
    private long chainSequence;
    /** Stored hash matches the hash recomputed from the stored fields. */
    private boolean hashValid;
    /** Stored previous hash matches the predecessor's event hash. */
    private boolean linked;
    private String eventHash;
    private String prevEventHash;
    private Instant verifiedAt;
}
