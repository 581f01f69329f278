package com.echelon.kernel.ratelimit;

import java.util.List;

/**
 * The increments taken for one admitted request.
 *
 * @param leases    one lease per bucket incremented
 * @param remaining smallest remaining allowance across all buckets
 * @param limit     limit of the bucket with the smallest remaining allowance
 */
public record RateLimitDecision(List<WindowLease> leases, long remaining, long limit) {

    public RateLimitDecision {
        leases = leases == null ? List.of() : List.copyOf(leases);
    }

    /** A decision that took no increments. */
    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(List.of(), Long.MAX_VALUE, Long.MAX_VALUE);
    }
}
