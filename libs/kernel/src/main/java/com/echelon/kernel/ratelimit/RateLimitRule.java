package com.echelon.kernel.ratelimit;

/**
 * Base limit for one dimension and window, before tier scaling.
 */
public record RateLimitRule(RateLimitDimension dimension, RateLimitWindow window, long limit) {

    public RateLimitRule {
        if (dimension == null || window == null) {
            throw new IllegalArgumentException("dimension and window are required");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
    }
}
