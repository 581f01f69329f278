package com.echelon.security;

import java.time.Instant;

/**
 * A billing and ownership boundary.
 *
 * <p>WHY a record: tenants are read on every request and must never be mutated in place;
 * the repository swaps whole values when the verification flag or tier changes.
 *
 * @param tenantId          unique tenant identifier
 * @param name              human-readable name
 * @param verificationState current verification state
 * @param tier              billing tier (scales rate limits)
 * @param createdAt         signup time
 */
public record Tenant(
        String tenantId,
        String name,
        VerificationState verificationState,
        TenantTier tier,
        Instant createdAt) {

    public Tenant {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (verificationState == null) {
            verificationState = VerificationState.UNVERIFIED;
        }
        if (tier == null) {
            tier = TenantTier.FREE;
        }
    }

    /** Creates a freshly signed-up, unverified tenant. */
    public static Tenant signup(String tenantId, String name, TenantTier tier, Instant createdAt) {
        return new Tenant(tenantId, name, VerificationState.UNVERIFIED, tier, createdAt);
    }

    public boolean verified() {
        return verificationState == VerificationState.VERIFIED;
    }

    public Tenant withVerificationState(VerificationState state) {
        return new Tenant(tenantId, name, state, tier, createdAt);
    }

    public Tenant withTier(TenantTier newTier) {
        return new Tenant(tenantId, name, verificationState, newTier, createdAt);
    }
}
