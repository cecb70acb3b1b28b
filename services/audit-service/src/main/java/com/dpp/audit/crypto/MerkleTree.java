package com.dpp.audit.crypto;

import com.dpp.audit.exception.EmptyMerkleInputException;
import com.dpp.audit.exception.LeafIndexOutOfRangeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binary Merkle tree over hex leaf hashes.
 *
 * <p>Pairing rules:
 * <ul>
 *   <li>a single leaf is its own root, no hashing;</li>
 *   <li>adjacent nodes are paired left to right and the parent is
 *       {@code SHA-256(utf8(left) || utf8(right))} as lowercase hex;</li>
 *   <li>on a level with an odd count the last node is paired with itself.</li>
 * </ul>
 * Pair order is never sorted, so reordering leaves changes the root.
 *
 * <p>The static operations are the only implementation of these rules.
 * Anchoring and proof endpoints delegate here.
 */
public final class MerkleTree {

    private final List<String> leaves;
    private final String root;

    private MerkleTree(List<String> leaves) {
        this.leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
        this.root = computeRoot(this.leaves);
    }

    public static MerkleTree of(List<String> leaves) {
        return new MerkleTree(leaves);
    }

    public String getRoot() {
        return root;
    }

    public int size() {
        return leaves.size();
    }

    public List<String> getLeaves() {
        return leaves;
    }

    public List<ProofStep> inclusionProof(int index) {
        return computeInclusionProof(leaves, index);
    }

    public boolean verify(String leafHash, List<ProofStep> proof) {
        return verifyInclusionProof(leafHash, proof, root);
    }

    public static String computeRoot(List<String> leafHashes) {
        if (leafHashes == null || leafHashes.isEmpty()) {
            throw new EmptyMerkleInputException("Cannot compute a Merkle root of zero leaves");
        }
        List<String> level = new ArrayList<>(leafHashes);
        while (level.size() > 1) {
            level = nextLevel(level);
        }
        return level.get(0);
    }

    public static List<ProofStep> computeInclusionProof(List<String> leafHashes, int index) {
        if (leafHashes == null || leafHashes.isEmpty()) {
            throw new EmptyMerkleInputException("Cannot build an inclusion proof over zero leaves");
        }
        if (index < 0 || index >= leafHashes.size()) {
            throw new LeafIndexOutOfRangeException(index, leafHashes.size());
        }

        List<ProofStep> proof = new ArrayList<>();
        List<String> level = new ArrayList<>(leafHashes);
        int position = index;
        while (level.size() > 1) {
            if (position % 2 == 0) {
                // an unpaired last node is its own sibling
                String sibling = position + 1 < level.size() ? level.get(position + 1) : level.get(position);
                proof.add(ProofStep.right(sibling));
            } else {
                proof.add(ProofStep.left(level.get(position - 1)));
            }
            level = nextLevel(level);
            position /= 2;
        }
        return proof;
    }

    public static boolean verifyInclusionProof(String leafHash, List<ProofStep> proof, String expectedRoot) {
        if (leafHash == null || proof == null || expectedRoot == null) {
            return false;
        }
        String current = leafHash;
        for (ProofStep step : proof) {
            if (step == null || step.getSibling() == null || step.getSide() == null) {
                return false;
            }
            current = step.getSide() == ProofStep.Side.LEFT
                    ? hashPair(step.getSibling(), current)
                    : hashPair(current, step.getSibling());
        }
        return current.equals(expectedRoot);
    }

    static String hashPair(String left, String right) {
        return Digests.sha256Hex(left, right);
    }

    private static List<String> nextLevel(List<String> level) {
        List<String> parents = new ArrayList<>((level.size() + 1) / 2);
        for (int i = 0; i < level.size(); i += 2) {
            String left = level.get(i);
            String right = i + 1 < level.size() ? level.get(i + 1) : left;
            parents.add(hashPair(left, right));
        }
        return parents;
    }
}
