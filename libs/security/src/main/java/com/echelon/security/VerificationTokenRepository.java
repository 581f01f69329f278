package com.echelon.security;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage port for verification tokens.
 */
public interface VerificationTokenRepository {

    void save(VerificationToken token);

    Optional<VerificationToken> findByHash(String tokenHash);

    /**
     * Compare-and-set consumption: marks the token consumed only if it is currently unconsumed.
     *
     * @return true for exactly one caller per token
     */
    boolean markConsumed(String tokenHash, Instant when);

    /**
     * Undoes {@link #markConsumed} when the tenant could not be verified afterwards. Only
     * clears a consumption made at {@code when}.
     *
     * @return true if the token is redeemable again
     */
    boolean restoreConsumed(String tokenHash, Instant when);
}
