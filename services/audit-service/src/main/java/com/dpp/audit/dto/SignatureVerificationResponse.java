package com.dpp.audit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignatureVerificationResponse {
    private UUID anchorId;
    private String rootHash;
    private String signatureKid;
    /** {@code null} when no verification key is configured. */
    private Boolean signatureValid;
    /** Root recomputed from the covered events equals the stored root. */
    private boolean rootMatchesEvents;
    private boolean timestamped;
    /** {@code null} when the anchor has no timestamp token. */
    private Boolean timestampValid;
}
