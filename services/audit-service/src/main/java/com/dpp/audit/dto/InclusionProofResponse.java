package com.dpp.audit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.dpp.audit.crypto.ProofStep;

import java.util.List;
import java.util.UUID;

/**
 * Inclusion proof of one event in its covering anchor. Auditors can replay it
 * with nothing but SHA-256.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InclusionProofResponse {
    private UUID eventId;
    private UUID anchorId;
    private long chainSequence;
    private int leafIndex;
    private String leafHash;
    private String rootHash;
    private List<ProofStep> proof;
    private boolean verified;
}
