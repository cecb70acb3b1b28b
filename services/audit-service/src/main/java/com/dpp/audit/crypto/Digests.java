package com.dpp.audit.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * SHA-256 helpers shared by the hash chain and the Merkle tree.
 */
public final class Digests {

    public static final String SHA_256 = "SHA-256";

    private static final HexFormat HEX = HexFormat.of();
    private static final Pattern HEX_DIGEST = Pattern.compile("[0-9a-f]{64}");

    private Digests() {
    }

    public static byte[] sha256(byte[]... parts) {
        MessageDigest digest = newSha256();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return digest.digest();
    }

    /**
     * Lowercase hex SHA-256 over the UTF-8 bytes of each part, in order.
     */
    public static String sha256Hex(String... parts) {
        MessageDigest digest = newSha256();
        for (String part : parts) {
            digest.update(part.getBytes(StandardCharsets.UTF_8));
        }
        return HEX.formatHex(digest.digest());
    }

    public static byte[] sha256Utf8(String value) {
        return sha256(value.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean isHexDigest(String value) {
        return value != null && HEX_DIGEST.matcher(value).matches();
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance(SHA_256);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available in this JVM", e);
        }
    }
}
