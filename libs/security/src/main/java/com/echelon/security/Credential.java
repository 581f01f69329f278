package com.echelon.security;

import java.time.Instant;
import java.util.Set;

/**
 * An API key belonging to exactly one tenant.
 * <p>
 * Only the lookup prefix and a one-way hash of the raw secret are kept. The declared
 * {@code scopes} are an upper bound: the effective set also depends on the tenant's
 * verification state and is computed by {@link Scopes#effective(Set, VerificationState)}.
 *
 * @param credentialId opaque identifier (audit actor ID)
 * @param tenantId     owning tenant
 * @param keyPrefix    short lookup prefix of the raw key
 * @param keyHash      hex-encoded hash of the raw key
 * @param name         optional label
 * @param scopes       declared scopes
 * @param createdAt    issue time
 * @param expiresAt    optional expiry (null = never)
 * @param lastUsedAt   last successful resolution (nullable)
 * @param revokedAt    revocation time (null = active)
 */
public record Credential(
        String credentialId,
        String tenantId,
        String keyPrefix,
        String keyHash,
        String name,
        Set<String> scopes,
        Instant createdAt,
        Instant expiresAt,
        Instant lastUsedAt,
        Instant revokedAt) {

    public Credential {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    /** Active means neither revoked nor expired at {@code now}. */
    public boolean isActive(Instant now) {
        return !isRevoked() && !isExpired(now);
    }

    public Credential withLastUsedAt(Instant when) {
        return new Credential(credentialId, tenantId, keyPrefix, keyHash, name, scopes,
                createdAt, expiresAt, when, revokedAt);
    }

    public Credential withRevokedAt(Instant when) {
        return new Credential(credentialId, tenantId, keyPrefix, keyHash, name, scopes,
                createdAt, expiresAt, lastUsedAt, when);
    }

    public Credential withDetails(String newName, Set<String> newScopes, Instant newExpiresAt) {
        return new Credential(credentialId, tenantId, keyPrefix, keyHash, newName, newScopes,
                createdAt, newExpiresAt, lastUsedAt, revokedAt);
    }
}
