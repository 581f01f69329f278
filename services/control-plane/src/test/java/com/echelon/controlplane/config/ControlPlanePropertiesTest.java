package com.echelon.controlplane.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.echelon.kernel.ceiling.Ceilings;
import com.echelon.kernel.ratelimit.RateLimitDimension;
import com.echelon.kernel.ratelimit.RateLimitPolicy;
import com.echelon.kernel.ratelimit.RateLimitRule;
import com.echelon.kernel.ratelimit.RateLimitWindow;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Compact-constructor defaults and the translation into kernel settings, without a Spring context.
 */
@DisplayName("ControlPlaneProperties")
class ControlPlanePropertiesTest {

    private static ControlPlaneProperties props(ControlPlaneProperties.RateLimits rateLimits,
                                                ControlPlaneProperties.Ceilings ceilings) {
        return new ControlPlaneProperties(null, null, null, null, null, 0, 0, null, rateLimits, ceilings, null);
    }

    private static long limit(RateLimitPolicy policy, RateLimitDimension dimension,
                              RateLimitWindow window) {
        return policy.rules().stream()
                .filter(r -> r.dimension() == dimension && r.window().equals(window))
                .mapToLong(RateLimitRule::limit)
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("defaults thread pool and audit queue when zero")
    void defaultsSizes() {
        var props = props(null, null);

        assertThat(props.handlerThreads()).isEqualTo(32);
        assertThat(props.auditQueueCapacity()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("unset values fall back to the kernel defaults")
    void kernelDefaults() {
        var settings = props(null, null).toSettings();

        assertThat(settings.idempotencyTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(settings.idempotencyInFlightTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.defaultTimeout()).isNull();
        assertThat(limit(settings.rateLimits(), RateLimitDimension.API_KEY, RateLimitWindow.BURST))
                .isEqualTo(1_000);
        assertThat(settings.ceilings().tenantActionsPerSecond()).isEqualTo(Ceilings.TENANT_ACTIONS_PER_SECOND);
    }

    @Test
    @DisplayName("overrides only the configured windows")
    void partialRateLimitOverride() {
        var rateLimits = new ControlPlaneProperties.RateLimits(
                new ControlPlaneProperties.WindowLimits(10L, null, null), null, null,
                Map.of("settings.update", 5L));

        var policy = props(rateLimits, null).toSettings().rateLimits();

        assertThat(limit(policy, RateLimitDimension.API_KEY, RateLimitWindow.BURST)).isEqualTo(10);
        assertThat(limit(policy, RateLimitDimension.API_KEY, RateLimitWindow.HOURLY)).isEqualTo(10_000);
        assertThat(limit(policy, RateLimitDimension.TENANT, RateLimitWindow.BURST)).isEqualTo(2_000);
        assertThat(policy.actionOverrides())
                .containsEntry("settings.update", 5L)
                .containsEntry("iam.keys.create", 20L);
    }

    @Test
    @DisplayName("ceiling overrides are merged over the hard constants")
    void ceilingOverrides() {
        var ceilings = new ControlPlaneProperties.Ceilings(10L, Map.of("webhooks.create", 3L));

        var policy = props(null, ceilings).toSettings().ceilings();

        assertThat(policy.tenantActionsPerSecond()).isEqualTo(10);
        assertThat(policy.actionDaily())
                .containsEntry("webhooks.create", 3L)
                .containsEntry("iam.keys.create", 25L);
    }
}
