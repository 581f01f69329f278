package com.echelon.kernel.ratelimit;

import java.util.List;
import java.util.Map;

/**
 * Rate-limit configuration.
 * <p>
 * {@code rules} are scaled by the tenant tier's multiplier. {@code actionOverrides} add a
 * per-credential, per-action bucket in the burst window for high-risk actions; overrides are
 * not tier-scaled.
 *
 * @param rules           base limits per dimension and window
 * @param actionOverrides burst-window API-key limit per action name
 */
public record RateLimitPolicy(List<RateLimitRule> rules, Map<String, Long> actionOverrides) {

    public RateLimitPolicy {
        rules = rules == null ? List.of() : List.copyOf(rules);
        actionOverrides = actionOverrides == null ? Map.of() : Map.copyOf(actionOverrides);
    }

    /**
     * Defaults: per API key 1000/5m, 10 000/1h, 100 000/24h; per tenant 2000/5m, 20 000/1h,
     * 200 000/24h; per source IP 1000/5m, 10 000/1h, 100 000/24h. High-risk IAM actions are
     * capped at 20 per key per burst window.
     */
    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(
                List.of(
                        new RateLimitRule(RateLimitDimension.API_KEY, RateLimitWindow.BURST, 1_000),
                        new RateLimitRule(RateLimitDimension.API_KEY, RateLimitWindow.HOURLY, 10_000),
                        new RateLimitRule(RateLimitDimension.API_KEY, RateLimitWindow.DAILY, 100_000),
                        new RateLimitRule(RateLimitDimension.TENANT, RateLimitWindow.BURST, 2_000),
                        new RateLimitRule(RateLimitDimension.TENANT, RateLimitWindow.HOURLY, 20_000),
                        new RateLimitRule(RateLimitDimension.TENANT, RateLimitWindow.DAILY, 200_000),
                        new RateLimitRule(RateLimitDimension.SOURCE_IP, RateLimitWindow.BURST, 1_000),
                        new RateLimitRule(RateLimitDimension.SOURCE_IP, RateLimitWindow.HOURLY, 10_000),
                        new RateLimitRule(RateLimitDimension.SOURCE_IP, RateLimitWindow.DAILY, 100_000)),
                Map.of("iam.keys.create", 20L, "iam.keys.revoke", 20L));
    }
}
