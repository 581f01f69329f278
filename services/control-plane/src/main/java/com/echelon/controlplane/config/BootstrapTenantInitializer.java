package com.echelon.controlplane.config;

import com.echelon.security.ApiKeys;
import com.echelon.security.Credential;
import com.echelon.security.CredentialRepository;
import com.echelon.security.Scopes;
import com.echelon.security.SecretHasher;
import com.echelon.security.Tenant;
import com.echelon.security.TenantRepository;
import com.echelon.security.TenantTier;
import com.echelon.security.VerificationState;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Provisions the tenant and API key from {@code echelon.kernel.bootstrap} at startup.
 * Existing tenants and keys are left untouched, so restarts against durable storage are safe.
 */
@Component
public class BootstrapTenantInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapTenantInitializer.class);

    static final String BOOTSTRAP_CREDENTIAL_ID = "key_bootstrap";

    private final ControlPlaneProperties properties;
    private final TenantRepository tenants;
    private final CredentialRepository credentials;
    private final SecretHasher hasher;
    private final Clock clock;

    public BootstrapTenantInitializer(ControlPlaneProperties properties, TenantRepository tenants,
                                      CredentialRepository credentials, SecretHasher hasher, Clock clock) {
        this.properties = properties;
        this.tenants = tenants;
        this.credentials = credentials;
        this.hasher = hasher;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        ControlPlaneProperties.Bootstrap bootstrap = properties.bootstrap();
        if (bootstrap == null) {
            return;
        }
        Instant now = clock.instant();
        if (tenants.findById(bootstrap.tenantId()).isEmpty()) {
            TenantTier tier = TenantTier.fromString(bootstrap.tier()).orElse(TenantTier.STANDARD);
            Tenant tenant = Tenant.signup(bootstrap.tenantId(),
                    bootstrap.name() == null ? bootstrap.tenantId() : bootstrap.name(), tier, now);
            if (bootstrap.verified()) {
                tenant = tenant.withVerificationState(VerificationState.VERIFIED);
            }
            tenants.save(tenant);
            log.info("Bootstrap tenant created: tenantId={} tier={} state={}",
                    tenant.tenantId(), tier.value(), tenant.verificationState().value());
        }

        String prefix = ApiKeys.lookupPrefix(bootstrap.apiKey())
                .orElseThrow(() -> new IllegalStateException("Bootstrap API key is malformed"));
        boolean registered = credentials.findByPrefix(prefix).stream()
                .anyMatch(c -> hasher.matches(bootstrap.apiKey(), c.keyHash()));
        if (registered) {
            return;
        }
        Set<String> scopes = bootstrap.scopes() == null || bootstrap.scopes().isEmpty()
                ? new LinkedHashSet<>(Scopes.ALL) : new LinkedHashSet<>(bootstrap.scopes());
        credentials.save(new Credential(BOOTSTRAP_CREDENTIAL_ID, bootstrap.tenantId(), prefix,
                hasher.hash(bootstrap.apiKey()), "bootstrap", scopes, now, null, null, null));
        log.info("Bootstrap API key registered: tenantId={} prefix={}", bootstrap.tenantId(), prefix);
    }
}
