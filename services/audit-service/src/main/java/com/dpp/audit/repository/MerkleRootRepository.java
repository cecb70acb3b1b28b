package com.dpp.audit.repository;

import com.dpp.audit.domain.MerkleRoot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MerkleRootRepository extends JpaRepository<MerkleRoot, UUID> {

    Optional<MerkleRoot> findFirstByTenantIdOrderByLastSequenceDesc(UUID tenantId);

    Optional<MerkleRoot> findFirstByTenantIdIsNullOrderByLastSequenceDesc();

    Optional<MerkleRoot> findFirstByTenantIdAndFirstSequenceLessThanEqualAndLastSequenceGreaterThanEqual(
            UUID tenantId, long sequence, long sameSequence);

    Optional<MerkleRoot> findFirstByTenantIdIsNullAndFirstSequenceLessThanEqualAndLastSequenceGreaterThanEqual(
            long sequence, long sameSequence);

    List<MerkleRoot> findByTenantIdOrderByFirstSequenceAsc(UUID tenantId);

    List<MerkleRoot> findByTenantIdIsNullOrderByFirstSequenceAsc();

    default Optional<MerkleRoot> findLatestAnchor(UUID tenantId) {
        return tenantId != null
                ? findFirstByTenantIdOrderByLastSequenceDesc(tenantId)
                : findFirstByTenantIdIsNullOrderByLastSequenceDesc();
    }

    /** Anchor whose range contains the given chain sequence. */
    default Optional<MerkleRoot> findCoveringAnchor(UUID tenantId, long chainSequence) {
        return tenantId != null
                ? findFirstByTenantIdAndFirstSequenceLessThanEqualAndLastSequenceGreaterThanEqual(
                        tenantId, chainSequence, chainSequence)
                : findFirstByTenantIdIsNullAndFirstSequenceLessThanEqualAndLastSequenceGreaterThanEqual(
                        chainSequence, chainSequence);
    }

    default List<MerkleRoot> findAnchors(UUID tenantId) {
        return tenantId != null
                ? findByTenantIdOrderByFirstSequenceAsc(tenantId)
                : findByTenantIdIsNullOrderByFirstSequenceAsc();
    }
}
