package com.echelon.kernel.ratelimit;

import java.time.Duration;

/**
 * A named fixed window.
 *
 * @param name   short label used in store keys and error details (e.g. {@code "5m"})
 * @param length window length
 */
public record RateLimitWindow(String name, Duration length) {

    public static final RateLimitWindow BURST = new RateLimitWindow("5m", Duration.ofMinutes(5));
    public static final RateLimitWindow HOURLY = new RateLimitWindow("1h", Duration.ofHours(1));
    public static final RateLimitWindow DAILY = new RateLimitWindow("24h", Duration.ofHours(24));

    public RateLimitWindow {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("window name must not be blank");
        }
        if (length == null || length.isZero() || length.isNegative()) {
            throw new IllegalArgumentException("window length must be positive");
        }
    }
}
