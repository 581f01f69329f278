package com.echelon.security;

import java.time.Instant;

/**
 * A single-use, tenant-scoped verification token, stored only as a hash.
 *
 * @param tokenHash  hash of the raw token (primary key)
 * @param tenantId   tenant the token verifies
 * @param issuedAt   issue time
 * @param expiresAt  issue time + TTL
 * @param consumedAt redemption time (null while unused)
 */
public record VerificationToken(
        String tokenHash,
        String tenantId,
        Instant issuedAt,
        Instant expiresAt,
        Instant consumedAt) {

    public boolean isConsumed() {
        return consumedAt != null;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public VerificationToken consume(Instant when) {
        return new VerificationToken(tokenHash, tenantId, issuedAt, expiresAt, when);
    }
}
