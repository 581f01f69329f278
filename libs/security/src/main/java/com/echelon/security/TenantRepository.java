package com.echelon.security;

import java.util.Optional;

/**
 * Storage port for tenants.
 */
public interface TenantRepository {

    Optional<Tenant> findById(String tenantId);

    void save(Tenant tenant);

    /**
     * Atomically moves the tenant to {@link VerificationState#VERIFIED}.
     *
     * @return true if the tenant exists (whether or not it was already verified)
     */
    boolean markVerified(String tenantId);
}
