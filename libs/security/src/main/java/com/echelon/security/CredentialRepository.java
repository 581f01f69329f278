package com.echelon.security;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for API key credentials.
 * <p>
 * Lookups go through the short key prefix; callers then verify the hash of each candidate.
 */
public interface CredentialRepository {

    List<Credential> findByPrefix(String keyPrefix);

    Optional<Credential> findById(String credentialId);

    List<Credential> listByTenant(String tenantId);

    void save(Credential credential);

    /** Best-effort update of {@code lastUsedAt}. */
    void touch(String credentialId, Instant when);

    /**
     * Revokes the credential.
     *
     * @return the revoked credential, or empty if unknown
     */
    Optional<Credential> revoke(String credentialId, Instant when);
}
