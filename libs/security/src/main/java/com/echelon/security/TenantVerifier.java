package com.echelon.security;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the {@code UNVERIFIED → VERIFIED} transition.
 * <p>
 * Tokens are issued to the external signup workflow and redeemed exactly once. Redemption
 * consumes the token with a compare-and-set before flipping the tenant flag, so concurrent
 * redemptions of the same token yield exactly one {@link VerificationResult#VERIFIED}.
 * If the tenant cannot be marked verified after that, the consumption is undone so the
 * token stays redeemable.
 */
public class TenantVerifier {

    private static final Logger log = LoggerFactory.getLogger(TenantVerifier.class);

    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(24);

    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final TenantRepository tenants;
    private final VerificationTokenRepository tokens;
    private final SecretHasher hasher;
    private final Clock clock;
    private final Duration tokenTtl;

    public TenantVerifier(TenantRepository tenants, VerificationTokenRepository tokens,
                          SecretHasher hasher, Clock clock, Duration tokenTtl) {
        this.tenants = Objects.requireNonNull(tenants, "tenants");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tokenTtl = tokenTtl == null ? DEFAULT_TOKEN_TTL : tokenTtl;
    }

    /**
     * Issues a verification token for the tenant.
     *
     * @return the raw token; only its hash is stored
     * @throws IllegalArgumentException if the tenant does not exist
     */
    public String issue(String tenantId) {
        if (tenants.findById(tenantId).isEmpty()) {
            throw new IllegalArgumentException("Unknown tenant: " + tenantId);
        }
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        String raw = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        Instant now = clock.instant();
        tokens.save(new VerificationToken(hasher.hash(raw), tenantId, now, now.plus(tokenTtl), null));
        log.info("Issued verification token for tenant {} (expires in {})", tenantId, tokenTtl);
        return raw;
    }

    /**
     * Redeems a token for the given tenant.
     */
    public VerificationResult redeem(String tenantId, String rawToken) {
        if (tenantId == null || rawToken == null || rawToken.isBlank()) {
            return VerificationResult.INVALID_TOKEN;
        }
        String hash = hasher.hash(rawToken);
        Optional<VerificationToken> found = tokens.findByHash(hash);
        Instant now = clock.instant();
        if (found.isEmpty()) {
            log.debug("Verification token not found for tenant {}", tenantId);
            return VerificationResult.INVALID_TOKEN;
        }
        VerificationToken token = found.get();
        if (!token.tenantId().equals(tenantId) || token.isConsumed() || token.isExpired(now)) {
            log.debug("Verification token rejected for tenant {} (consumed={}, expired={})",
                    tenantId, token.isConsumed(), token.isExpired(now));
            return VerificationResult.INVALID_TOKEN;
        }
        if (!tokens.markConsumed(hash, now)) {
            return VerificationResult.INVALID_TOKEN;
        }
        boolean verified;
        try {
            verified = tenants.markVerified(tenantId);
        } catch (RuntimeException e) {
            try {
                restore(hash, now, tenantId);
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
        if (!verified) {
            restore(hash, now, tenantId);
            return VerificationResult.INVALID_TOKEN;
        }
        log.info("Tenant {} verified", tenantId);
        return VerificationResult.VERIFIED;
    }

    private void restore(String hash, Instant consumedAt, String tenantId) {
        boolean restored = tokens.restoreConsumed(hash, consumedAt);
        log.error("Tenant {} was not marked verified after its token was consumed (token restored={})",
                tenantId, restored);
    }
}
