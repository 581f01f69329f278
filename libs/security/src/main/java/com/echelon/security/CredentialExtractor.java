package com.echelon.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts raw API keys from request headers.
 * <p>
 * WHY a utility class: hosts accept the key either as {@code X-API-Key} or as a
 * {@code "Bearer xxx"} Authorization header. Centralising the parsing keeps the
 * precedence rule identical everywhere.
 */
public final class CredentialExtractor {

    private static final String BEARER = "bearer";

    private CredentialExtractor() {
        // utility class
    }

    /**
     * Extracts the key from the {@code X-API-Key} header, falling back to the bearer token.
     *
     * @param apiKeyHeader        value of {@code X-API-Key} (may be null)
     * @param authorizationHeader value of {@code Authorization} (may be null)
     * @return the raw key, or empty if neither header carries one
     */
    public static Optional<String> extract(String apiKeyHeader, String authorizationHeader) {
        if (apiKeyHeader != null && !apiKeyHeader.isBlank()) {
            return Optional.of(apiKeyHeader.strip());
        }
        return extractBearer(authorizationHeader);
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     * <p>
     * Expects format: {@code "Bearer <token>"}
     */
    public static Optional<String> extractBearer(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER)) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER.length()).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
