package com.echelon.kernel.identity;

import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.store.StoreRetrier;
import com.echelon.security.ApiKeys;
import com.echelon.security.Credential;
import com.echelon.security.CredentialRepository;
import com.echelon.security.Scopes;
import com.echelon.security.SecretHasher;
import com.echelon.security.Tenant;
import com.echelon.security.TenantRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw API key into a {@link ResolvedIdentity}.
 * <p>
 * Candidates are found by lookup prefix, then each candidate's hash is compared in constant
 * time. Every authentication failure (missing, malformed, unknown, wrong secret, expired,
 * revoked, orphaned) yields the same {@code INVALID_API_KEY} error. The effective scope set is
 * recomputed from the tenant's current verification state on every call.
 */
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final TenantRepository tenants;
    private final CredentialRepository credentials;
    private final SecretHasher hasher;
    private final Clock clock;
    private final StoreRetrier retrier;

    public IdentityResolver(TenantRepository tenants, CredentialRepository credentials,
                            SecretHasher hasher, Clock clock, StoreRetrier retrier) {
        this.tenants = Objects.requireNonNull(tenants, "tenants");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retrier = retrier == null ? StoreRetrier.none() : retrier;
    }

    /**
     * Resolves the caller.
     *
     * @param rawCredential the presented API key
     * @param tenantHint    optional tenant the caller claims to act for
     * @throws KernelException {@code INVALID_API_KEY} or {@code TENANT_MISMATCH}
     */
    public ResolvedIdentity resolve(String rawCredential, String tenantHint) {
        Optional<String> prefix = ApiKeys.lookupPrefix(rawCredential);
        if (prefix.isEmpty()) {
            log.debug("Rejected credential: missing or malformed");
            throw KernelException.unauthenticated();
        }
        List<Credential> candidates = retrier.execute("credentials.findByPrefix",
                () -> credentials.findByPrefix(prefix.get()));
        Credential match = null;
        for (Credential candidate : candidates) {
            if (hasher.matches(rawCredential, candidate.keyHash()) && match == null) {
                match = candidate;
            }
        }
        Instant now = clock.instant();
        if (match == null || !match.isActive(now)) {
            log.debug("Rejected credential with prefix {}", prefix.get());
            throw KernelException.unauthenticated();
        }
        String tenantId = match.tenantId();
        Optional<Tenant> tenant = retrier.execute("tenants.findById", () -> tenants.findById(tenantId));
        if (tenant.isEmpty()) {
            log.warn("Credential {} references missing tenant {}", match.credentialId(), tenantId);
            throw KernelException.unauthenticated();
        }
        if (tenantHint != null && !tenantHint.isBlank() && !tenantHint.equals(tenantId)) {
            throw KernelException.tenantMismatch(tenantHint);
        }
        touch(match.credentialId(), now);
        Tenant t = tenant.get();
        return new ResolvedIdentity(match.credentialId(), match.keyPrefix(), t.tenantId(),
                t.verificationState(), t.tier(), Scopes.effective(match.scopes(), t.verificationState()));
    }

    /**
     * Fails with {@code SCOPE_DENIED} naming the missing scope unless the identity holds it.
     */
    public static void requireScope(ResolvedIdentity identity, String scope) {
        if (!identity.hasScope(scope)) {
            throw KernelException.forbidden(scope);
        }
    }

    private void touch(String credentialId, Instant now) {
        try {
            credentials.touch(credentialId, now);
        } catch (RuntimeException e) {
            log.debug("Failed to record last use of credential {}", credentialId, e);
        }
    }
}
