package com.dpp.audit.crypto;

import com.dpp.audit.config.AuditProperties;
import com.dpp.audit.exception.AnchorSigningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Ed25519 signatures over Merkle root hashes. The message is the UTF-8 bytes
 * of the hex root; signatures are Base64 encoded.
 *
 * <p>Keys are loaded once at startup. A missing private key does not stop the
 * service from starting, but every {@link #sign(String)} call then fails.
 */
@Slf4j
@Component
public class MerkleRootSigner {

    public static final String ALGORITHM = "Ed25519";

    private final PrivateKey privateKey;
    private final PublicKey publicKey;
    private final String keyId;

    public MerkleRootSigner(AuditProperties auditProperties) {
        AuditProperties.SigningProperties signing = auditProperties.getSigning();
        this.privateKey = StringUtils.hasText(signing.getPrivateKey()) ? decodePrivateKey(signing.getPrivateKey()) : null;
        this.publicKey = StringUtils.hasText(signing.getPublicKey()) ? decodePublicKey(signing.getPublicKey()) : null;
        this.keyId = signing.getKeyId();
        if (privateKey == null) {
            log.warn("No Merkle root signing key configured, anchoring will fail until audit.signing.private-key is set");
        }
    }

    public String sign(String rootHash) {
        if (privateKey == null) {
            throw new AnchorSigningException("No Merkle root signing key configured");
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(rootHash.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new AnchorSigningException("Failed to sign Merkle root " + rootHash, e);
        }
    }

    /**
     * @return false for a wrong or undecodable signature
     * @throws IllegalStateException when no public key is configured
     */
    public boolean verify(String rootHash, String base64Signature) {
        if (publicKey == null) {
            throw new IllegalStateException("No Merkle root verification key configured");
        }
        if (rootHash == null || base64Signature == null) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(rootHash.getBytes(StandardCharsets.UTF_8));
            return signature.verify(Base64.getDecoder().decode(base64Signature));
        } catch (IllegalArgumentException e) {
            log.debug("Signature is not valid Base64: {}", e.getMessage());
            return false;
        } catch (GeneralSecurityException e) {
            log.warn("Signature verification failed for root {}: {}", rootHash, e.getMessage());
            return false;
        }
    }

    public String getKeyId() {
        return keyId;
    }

    public boolean canVerify() {
        return publicKey != null;
    }

    private static PrivateKey decodePrivateKey(String base64) {
        try {
            byte[] encoded = Base64.getDecoder().decode(base64.trim());
            return KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(encoded));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("audit.signing.private-key is not a Base64 PKCS#8 Ed25519 key", e);
        }
    }

    private static PublicKey decodePublicKey(String base64) {
        try {
            byte[] encoded = Base64.getDecoder().decode(base64.trim());
            return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("audit.signing.public-key is not a Base64 X.509 Ed25519 key", e);
        }
    }
}
