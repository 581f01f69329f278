package com.echelon.kernel.ceiling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.echelon.kernel.error.ErrorKind;
import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.ratelimit.FixedWindowCounter;
import com.echelon.kernel.store.InMemoryKernelStore;
import com.echelon.kernel.testing.MutableClock;
import com.echelon.observability.MetricFactory;
import com.echelon.security.testing.TestIdentities;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CeilingEnforcer")
class CeilingEnforcerTest {

    private final MutableClock clock = new MutableClock(TestIdentities.EPOCH);
    private final FixedWindowCounter counter = new FixedWindowCounter(new InMemoryKernelStore(clock), clock);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private CeilingEnforcer enforcer(CeilingPolicy policy) {
        return new CeilingEnforcer(counter, policy, new MetricFactory(registry, "test"));
    }

    @Test
    @DisplayName("configured values above the hard constants are clamped down")
    void clampsConfiguration() {
        CeilingEnforcer enforcer = enforcer(new CeilingPolicy(10_000, Map.of("iam.keys.create", 1_000L)));

        assertThat(enforcer.tenantActionsPerSecond()).isEqualTo(Ceilings.TENANT_ACTIONS_PER_SECOND);
        assertThat(enforcer.dailyCeiling("iam.keys.create")).isEqualTo(25L);
    }

    @Test
    @DisplayName("configuration may lower a ceiling")
    void lowers() {
        CeilingEnforcer enforcer = enforcer(new CeilingPolicy(5, Map.of("webhooks.create", 3L)));
        assertThat(enforcer.tenantActionsPerSecond()).isEqualTo(5);
        assertThat(enforcer.dailyCeiling("webhooks.create")).isEqualTo(3L);
    }

    @Test
    @DisplayName("daily action ceiling rejects the 26th key creation and counts the breach")
    void dailyCeiling() {
        CeilingEnforcer enforcer = enforcer(CeilingPolicy.defaults());
        for (int i = 0; i < 25; i++) {
            enforcer.enforce("t-1", "iam.keys.create");
            clock.advance(Duration.ofSeconds(1));
        }

        var e = catchThrowableOfType(() -> enforcer.enforce("t-1", "iam.keys.create"), KernelException.class);

        assertThat(e.kind()).isEqualTo(ErrorKind.CEILING_EXCEEDED);
        assertThat(e.details()).containsEntry("limit", 25L);
        assertThat(registry.get("echelon.ceiling.breaches").counter().count()).isEqualTo(1.0);
        assertThatCode(() -> enforcer.enforce("t-2", "iam.keys.create")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("per-second ceiling applies to every action and resets next second")
    void perSecond() {
        CeilingEnforcer enforcer = enforcer(new CeilingPolicy(2, Map.of()));
        enforcer.enforce("t-1", "x.read");
        enforcer.enforce("t-1", "x.read");

        assertThat(catchThrowableOfType(() -> enforcer.enforce("t-1", "x.read"), KernelException.class))
                .isNotNull();
        clock.advance(Duration.ofSeconds(1));
        assertThatCode(() -> enforcer.enforce("t-1", "x.read")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("check() does not consume, release() hands back")
    void checkAndRelease() {
        CeilingEnforcer enforcer = enforcer(new CeilingPolicy(50, Map.of("webhooks.create", 1L)));
        enforcer.check("t-1", "webhooks.create");
        var leases = enforcer.enforce("t-1", "webhooks.create");
        assertThat(catchThrowableOfType(() -> enforcer.check("t-1", "webhooks.create"), KernelException.class))
                .isNotNull();

        enforcer.release(leases);

        assertThatCode(() -> enforcer.enforce("t-1", "webhooks.create")).doesNotThrowAnyException();
    }
}
