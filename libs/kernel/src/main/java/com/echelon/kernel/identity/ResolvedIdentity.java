package com.echelon.kernel.identity;

import com.echelon.security.TenantTier;
import com.echelon.security.VerificationState;
import java.util.Set;

/**
 * An authenticated caller.
 *
 * @param credentialId      credential that authenticated the request
 * @param keyPrefix         lookup prefix of the key (safe to log)
 * @param tenantId          owning tenant
 * @param verificationState tenant state at resolution time
 * @param tier              tenant tier
 * @param effectiveScopes   declared scopes filtered by verification state
 */
public record ResolvedIdentity(
        String credentialId,
        String keyPrefix,
        String tenantId,
        VerificationState verificationState,
        TenantTier tier,
        Set<String> effectiveScopes) {

    public ResolvedIdentity {
        effectiveScopes = effectiveScopes == null ? Set.of() : Set.copyOf(effectiveScopes);
    }

    public boolean hasScope(String scope) {
        return effectiveScopes.contains(scope);
    }
}
