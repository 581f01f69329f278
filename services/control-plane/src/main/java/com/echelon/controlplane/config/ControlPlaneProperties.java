package com.echelon.controlplane.config;

import com.echelon.kernel.ceiling.CeilingPolicy;
import com.echelon.kernel.config.KernelSettings;
import com.echelon.kernel.ratelimit.RateLimitDimension;
import com.echelon.kernel.ratelimit.RateLimitPolicy;
import com.echelon.kernel.ratelimit.RateLimitRule;
import com.echelon.kernel.ratelimit.RateLimitWindow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe kernel configuration bound from {@code echelon.kernel.*}.
 *
 * <p>WHY a separate record from {@link KernelSettings}: the libraries stay free of Spring, and
 * this record owns binding and Bean Validation. {@link #toSettings()} does the translation.
 *
 * <pre>
 * echelon:
 *   kernel:
 *     idempotency-ttl: 24h
 *     default-timeout: 30s
 *     rate-limits:
 *       api-key: { burst: 1000, hourly: 10000, daily: 100000 }
 *       actions: { iam.keys.create: 20 }
 *     ceilings:
 *       action-daily: { webhooks.create: 10 }
 * </pre>
 *
 * @param idempotencyTtl         retention of completed idempotency records (default 24h)
 * @param idempotencyInFlightTtl lifetime of an abandoned reservation (default 5m)
 * @param idempotencyWait        how long a concurrent duplicate waits (default 5s)
 * @param verificationTokenTtl   lifetime of verification tokens (default 24h)
 * @param defaultTimeout         request deadline when the caller sends none (null = none)
 * @param handlerThreads         size of the handler pool (default 32)
 * @param auditQueueCapacity     bound of the audit queue (default 10 000)
 * @param keyPepper              optional HMAC pepper for key and token hashes
 * @param rateLimits             rate-limit overrides; unset values keep the defaults
 * @param ceilings               ceiling overrides; values above the hard ceilings are clamped
 * @param bootstrap              optional tenant and key created at startup
 */
@ConfigurationProperties(prefix = "echelon.kernel")
@Validated
public record ControlPlaneProperties(
        Duration idempotencyTtl,
        Duration idempotencyInFlightTtl,
        Duration idempotencyWait,
        Duration verificationTokenTtl,
        Duration defaultTimeout,
        @Positive int handlerThreads,
        @Positive int auditQueueCapacity,
        String keyPepper,
        @Valid RateLimits rateLimits,
        @Valid Ceilings ceilings,
        @Valid Bootstrap bootstrap) {

    /**
     * Compact constructor: applies defaults for optional fields. Runs before Bean Validation,
     * so defaults satisfy constraints.
     */
    public ControlPlaneProperties {
        if (handlerThreads <= 0) {
            handlerThreads = 32;
        }
        if (auditQueueCapacity <= 0) {
            auditQueueCapacity = 10_000;
        }
        if (rateLimits == null) {
            rateLimits = new RateLimits(null, null, null, null);
        }
        if (ceilings == null) {
            ceilings = new Ceilings(null, null);
        }
    }

    /** Translates the bound values into the framework-free kernel settings. */
    public KernelSettings toSettings() {
        return new KernelSettings(idempotencyTtl, idempotencyInFlightTtl, idempotencyWait, null,
                verificationTokenTtl, rateLimits.toPolicy(), ceilings.toPolicy(), 0, null,
                defaultTimeout, auditQueueCapacity, null);
    }

    /** Per-window limits for one dimension. Null keeps the default. */
    public record WindowLimits(@Positive Long burst, @Positive Long hourly, @Positive Long daily) {

        Long limitFor(RateLimitWindow window) {
            if (window.equals(RateLimitWindow.BURST)) {
                return burst;
            }
            return window.equals(RateLimitWindow.HOURLY) ? hourly : daily;
        }
    }

    /**
     * Rate-limit overrides.
     *
     * @param apiKey   limits per credential
     * @param tenant   limits per tenant
     * @param sourceIp limits per caller address
     * @param actions  burst-window per-key limits for individual actions
     */
    public record RateLimits(
            @Valid WindowLimits apiKey,
            @Valid WindowLimits tenant,
            @Valid WindowLimits sourceIp,
            Map<String, Long> actions) {

        RateLimitPolicy toPolicy() {
            RateLimitPolicy defaults = RateLimitPolicy.defaults();
            List<RateLimitRule> rules = new ArrayList<>();
            for (RateLimitRule rule : defaults.rules()) {
                WindowLimits configured = limitsFor(rule.dimension());
                Long limit = configured == null ? null : configured.limitFor(rule.window());
                rules.add(limit == null ? rule : new RateLimitRule(rule.dimension(), rule.window(), limit));
            }
            Map<String, Long> overrides = new HashMap<>(defaults.actionOverrides());
            if (actions != null) {
                overrides.putAll(actions);
            }
            return new RateLimitPolicy(rules, overrides);
        }

        private WindowLimits limitsFor(RateLimitDimension dimension) {
            switch (dimension) {
                case API_KEY:
                    return apiKey;
                case TENANT:
                    return tenant;
                default:
                    return sourceIp;
            }
        }
    }

    /**
     * Ceiling overrides. Only lowering takes effect.
     *
     * @param tenantActionsPerSecond per-tenant actions per second
     * @param actionDaily            per-tenant daily count per action
     */
    public record Ceilings(@Positive Long tenantActionsPerSecond, Map<String, Long> actionDaily) {

        CeilingPolicy toPolicy() {
            CeilingPolicy defaults = CeilingPolicy.defaults();
            Map<String, Long> daily = new HashMap<>(defaults.actionDaily());
            if (actionDaily != null) {
                daily.putAll(actionDaily);
            }
            return new CeilingPolicy(
                    tenantActionsPerSecond == null ? defaults.tenantActionsPerSecond() : tenantActionsPerSecond,
                    daily);
        }
    }

    /**
     * A tenant and API key provisioned at startup, for single-tenant installs and local use.
     *
     * @param tenantId tenant to create if it does not exist
     * @param name     display name
     * @param tier     tier name (default standard)
     * @param verified create the tenant already verified
     * @param apiKey   raw key to register; only its hash is stored
     * @param scopes   declared scopes of the key (default: all)
     */
    public record Bootstrap(
            @NotBlank String tenantId,
            String name,
            String tier,
            boolean verified,
            @NotBlank @Pattern(regexp = "^ock_[A-Za-z0-9_-]{16,}$") String apiKey,
            List<String> scopes) {
    }
}
