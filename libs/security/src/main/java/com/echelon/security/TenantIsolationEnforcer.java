package com.echelon.security;

/**
 * Enforces tenant isolation by comparing the caller's tenant against a resource's tenant ID.
 * <p>
 * WHY a utility class: every pack handler that touches tenant-scoped resources must verify
 * that the resolved credential belongs to the same tenant. Fail-fast with
 * {@link TenantMismatchException} prevents data leakage.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the caller's tenant matches the resource's tenant.
     *
     * @param callerTenantId   the tenant of the resolved credential
     * @param resourceTenantId the tenant ID of the resource being accessed
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(String callerTenantId, String resourceTenantId) {
        if (callerTenantId == null || !callerTenantId.equals(resourceTenantId)) {
            throw new TenantMismatchException(callerTenantId, resourceTenantId);
        }
    }
}
