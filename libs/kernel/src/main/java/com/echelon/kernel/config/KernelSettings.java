package com.echelon.kernel.config;

import com.echelon.kernel.ceiling.CeilingPolicy;
import com.echelon.kernel.ratelimit.RateLimitPolicy;
import java.time.Duration;

/**
 * Framework-free kernel configuration. Hosts bind their own configuration format and
 * translate it into this record.
 *
 * @param idempotencyTtl         retention of completed idempotency records
 * @param idempotencyInFlightTtl retention of an in-flight reservation whose owner never finishes
 * @param idempotencyWait        how long a concurrent duplicate waits for the first request
 * @param idempotencyPoll        poll interval while waiting
 * @param verificationTokenTtl   lifetime of verification tokens
 * @param rateLimits             rate-limit rules and per-action overrides
 * @param ceilings               configured ceilings (clamped to the hard constants)
 * @param storeRetryAttempts     attempts for storage calls made before the handler runs
 * @param storeRetryBackoff      initial backoff between those attempts
 * @param defaultTimeout         request timeout when the caller supplies none (null = none)
 * @param auditQueueCapacity     bound of the write-behind audit queue
 * @param auditFlushInterval     worker poll interval
 */
public record KernelSettings(
        Duration idempotencyTtl,
        Duration idempotencyInFlightTtl,
        Duration idempotencyWait,
        Duration idempotencyPoll,
        Duration verificationTokenTtl,
        RateLimitPolicy rateLimits,
        CeilingPolicy ceilings,
        int storeRetryAttempts,
        Duration storeRetryBackoff,
        Duration defaultTimeout,
        int auditQueueCapacity,
        Duration auditFlushInterval) {

    public KernelSettings {
        if (idempotencyTtl == null) {
            idempotencyTtl = Duration.ofHours(24);
        }
        if (idempotencyInFlightTtl == null) {
            idempotencyInFlightTtl = Duration.ofMinutes(5);
        }
        if (idempotencyWait == null) {
            idempotencyWait = Duration.ofSeconds(5);
        }
        if (idempotencyPoll == null) {
            idempotencyPoll = Duration.ofMillis(25);
        }
        if (verificationTokenTtl == null) {
            verificationTokenTtl = Duration.ofHours(24);
        }
        if (rateLimits == null) {
            rateLimits = RateLimitPolicy.defaults();
        }
        if (ceilings == null) {
            ceilings = CeilingPolicy.defaults();
        }
        if (storeRetryAttempts < 1) {
            storeRetryAttempts = 3;
        }
        if (storeRetryBackoff == null) {
            storeRetryBackoff = Duration.ofMillis(20);
        }
        if (auditQueueCapacity < 1) {
            auditQueueCapacity = 10_000;
        }
        if (auditFlushInterval == null) {
            auditFlushInterval = Duration.ofMillis(200);
        }
    }

    public static KernelSettings defaults() {
        return new KernelSettings(null, null, null, null, null, null, null, 0, null, null, 0, null);
    }

    public KernelSettings withRateLimits(RateLimitPolicy policy) {
        return new KernelSettings(idempotencyTtl, idempotencyInFlightTtl, idempotencyWait, idempotencyPoll,
                verificationTokenTtl, policy, ceilings, storeRetryAttempts, storeRetryBackoff, defaultTimeout,
                auditQueueCapacity, auditFlushInterval);
    }

    public KernelSettings withCeilings(CeilingPolicy policy) {
        return new KernelSettings(idempotencyTtl, idempotencyInFlightTtl, idempotencyWait, idempotencyPoll,
                verificationTokenTtl, rateLimits, policy, storeRetryAttempts, storeRetryBackoff, defaultTimeout,
                auditQueueCapacity, auditFlushInterval);
    }
}
