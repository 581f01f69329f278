package com.echelon.security.memory;

import com.echelon.security.Tenant;
import com.echelon.security.TenantRepository;
import com.echelon.security.VerificationState;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TenantRepository} backed by a {@link ConcurrentHashMap}.
 */
public class InMemoryTenantRepository implements TenantRepository {

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();

    @Override
    public Optional<Tenant> findById(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public void save(Tenant tenant) {
        tenants.put(tenant.tenantId(), tenant);
    }

    @Override
    public boolean markVerified(String tenantId) {
        Tenant updated = tenants.computeIfPresent(tenantId,
                (id, tenant) -> tenant.withVerificationState(VerificationState.VERIFIED));
        return updated != null;
    }
}
