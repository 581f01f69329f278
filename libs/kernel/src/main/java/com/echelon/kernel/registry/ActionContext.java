package com.echelon.kernel.registry;

import com.echelon.kernel.error.KernelException;
import com.echelon.security.TenantIsolationEnforcer;
import com.echelon.security.TenantMismatchException;
import com.echelon.security.TenantTier;
import java.time.Clock;
import java.util.Set;

/**
 * Per-request facts handed to a handler. The tenant is always the resolved credential's
 * tenant; handlers must not trust tenant IDs found in the payload.
 *
 * @param requestId       kernel-assigned request ID
 * @param tenantId        caller's tenant
 * @param credentialId    caller's credential (audit actor)
 * @param tier            caller's tenant tier
 * @param effectiveScopes scopes after verification-state filtering
 * @param dryRun          true if the handler must only describe its impact
 * @param idempotencyKey  caller-supplied key, may be null
 * @param sourceIp        caller's address, may be null
 * @param clock           kernel clock
 */
public record ActionContext(
        String requestId,
        String tenantId,
        String credentialId,
        TenantTier tier,
        Set<String> effectiveScopes,
        boolean dryRun,
        String idempotencyKey,
        String sourceIp,
        Clock clock) {

    public ActionContext {
        effectiveScopes = effectiveScopes == null ? Set.of() : Set.copyOf(effectiveScopes);
    }

    /**
     * Fails with {@code NOT_FOUND} unless the resource belongs to the caller's tenant, so a
     * resource of another tenant is indistinguishable from one that does not exist.
     */
    public void requireOwned(String resourceTenantId, String resourceType, String resourceId) {
        try {
            TenantIsolationEnforcer.enforce(tenantId, resourceTenantId);
        } catch (TenantMismatchException e) {
            throw KernelException.resourceNotFound(resourceType, resourceId);
        }
    }

    public boolean hasScope(String scope) {
        return effectiveScopes.contains(scope);
    }
}
