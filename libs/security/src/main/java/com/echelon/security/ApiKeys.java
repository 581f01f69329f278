package com.echelon.security;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * API key format: {@code ock_} followed by 32 random bytes, base64url without padding.
 * The first {@value #PREFIX_LENGTH} characters form the lookup prefix.
 */
public final class ApiKeys {

    public static final String KEY_PREFIX = "ock_";
    public static final int PREFIX_LENGTH = 12;

    private static final int RANDOM_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private ApiKeys() {
        // utility class
    }

    /** Generates a new key and hashes it with the given hasher. */
    public static IssuedApiKey generate(SecretHasher hasher) {
        byte[] bytes = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(bytes);
        String raw = KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return new IssuedApiKey(raw, raw.substring(0, PREFIX_LENGTH), hasher.hash(raw));
    }

    /**
     * Returns the lookup prefix of a presented key, or empty when the key is malformed
     * (wrong scheme or too short to carry a prefix).
     */
    public static Optional<String> lookupPrefix(String rawKey) {
        if (rawKey == null || !rawKey.startsWith(KEY_PREFIX) || rawKey.length() <= PREFIX_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(rawKey.substring(0, PREFIX_LENGTH));
    }
}
