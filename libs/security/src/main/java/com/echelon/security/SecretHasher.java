package com.echelon.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * One-way hashing of API keys and verification tokens.
 * <p>
 * HMAC-SHA-256 keyed with a server-side pepper when one is configured, plain SHA-256
 * otherwise. Hashes are lower-case hex. Comparison is constant-time.
 */
public final class SecretHasher {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final byte[] pepper;

    private SecretHasher(byte[] pepper) {
        this.pepper = pepper;
    }

    /** Plain SHA-256 hasher. */
    public static SecretHasher sha256() {
        return new SecretHasher(null);
    }

    /** HMAC-SHA-256 hasher; a null or blank pepper degrades to plain SHA-256. */
    public static SecretHasher withPepper(String pepper) {
        if (pepper == null || pepper.isBlank()) {
            return sha256();
        }
        return new SecretHasher(pepper.getBytes(StandardCharsets.UTF_8));
    }

    public boolean peppered() {
        return pepper != null;
    }

    /**
     * Hashes the given secret.
     *
     * @throws IllegalStateException if the JVM lacks SHA-256 / HmacSHA256
     */
    public String hash(String secret) {
        byte[] input = secret.getBytes(StandardCharsets.UTF_8);
        try {
            if (pepper != null) {
                Mac mac = Mac.getInstance(HMAC_ALGORITHM);
                mac.init(new SecretKeySpec(pepper, HMAC_ALGORITHM));
                return HexFormat.of().formatHex(mac.doFinal(input));
            }
            return HexFormat.of().formatHex(MessageDigest.getInstance(DIGEST_ALGORITHM).digest(input));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Secret hashing unavailable", e);
        }
    }

    /**
     * Hashes {@code secret} and compares it to {@code expectedHash} in constant time.
     */
    public boolean matches(String secret, String expectedHash) {
        if (secret == null || expectedHash == null) {
            return false;
        }
        byte[] actual = hash(secret).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedHash.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }
}
