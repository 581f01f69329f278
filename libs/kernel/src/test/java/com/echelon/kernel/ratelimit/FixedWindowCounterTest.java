package com.echelon.kernel.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.echelon.kernel.ceiling.CeilingEnforcer;
import com.echelon.kernel.ceiling.CeilingPolicy;
import com.echelon.kernel.store.InMemoryKernelStore;
import com.echelon.kernel.store.StoreRetrier;
import com.echelon.kernel.store.StoreUnavailableException;
import com.echelon.kernel.testing.MutableClock;
import com.echelon.observability.MetricFactory;
import com.echelon.security.TenantTier;
import com.echelon.security.testing.TestIdentities;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FixedWindowCounter")
class FixedWindowCounterTest {

    private final MutableClock clock = new MutableClock(TestIdentities.EPOCH);

    /** Fails the first {@code n} reads and writes of each kind, then behaves normally. */
    static final class FlakyStore extends InMemoryKernelStore {

        final AtomicInteger getFailures;
        final AtomicInteger writeFailures;
        final AtomicInteger gets = new AtomicInteger();

        FlakyStore(MutableClock clock, int getFailures, int writeFailures) {
            super(clock);
            this.getFailures = new AtomicInteger(getFailures);
            this.writeFailures = new AtomicInteger(writeFailures);
        }

        @Override
        public Optional<String> get(String key) {
            gets.incrementAndGet();
            if (getFailures.getAndDecrement() > 0) {
                throw new StoreUnavailableException("store briefly unavailable");
            }
            return super.get(key);
        }

        @Override
        public boolean putIfAbsent(String key, String value, Duration ttl) {
            if (writeFailures.getAndDecrement() > 0) {
                throw new StoreUnavailableException("store briefly unavailable");
            }
            return super.putIfAbsent(key, value, ttl);
        }

        @Override
        public boolean compareAndSet(String key, String expected, String value, Duration ttl) {
            if (writeFailures.getAndDecrement() > 0) {
                throw new StoreUnavailableException("store briefly unavailable");
            }
            return super.compareAndSet(key, expected, value, ttl);
        }
    }

    @Nested
    @DisplayName("transient store failures")
    class TransientFailures {

        @Test
        @DisplayName("a failed bucket read is retried and the increment is taken once")
        void retriesRead() {
            FlakyStore store = new FlakyStore(clock, 1, 0);
            FixedWindowCounter counter = new FixedWindowCounter(store, clock, new StoreRetrier(3, Duration.ZERO));

            var acquisition = counter.tryAcquire("rl:key:cred-1:5m", Duration.ofMinutes(5), 10);

            assertThat(acquisition.allowed()).isTrue();
            assertThat(acquisition.count()).isEqualTo(1);
            assertThat(store.gets.get()).isEqualTo(2);
            assertThat(counter.peek("rl:key:cred-1:5m", Duration.ofMinutes(5))).isEqualTo(1);
        }

        @Test
        @DisplayName("failed writes on a new and an existing bucket are retried")
        void retriesWrites() {
            FlakyStore store = new FlakyStore(clock, 0, 1);
            FixedWindowCounter counter = new FixedWindowCounter(store, clock, new StoreRetrier(3, Duration.ZERO));
            counter.tryAcquire("rl:key:cred-1:5m", Duration.ofMinutes(5), 10);

            store.writeFailures.set(2);
            var second = counter.tryAcquire("rl:key:cred-1:5m", Duration.ofMinutes(5), 10);

            assertThat(second.allowed()).isTrue();
            assertThat(second.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("gives up after the configured attempts")
        void bounded() {
            FlakyStore store = new FlakyStore(clock, 5, 0);
            FixedWindowCounter counter = new FixedWindowCounter(store, clock, new StoreRetrier(3, Duration.ZERO));

            assertThatThrownBy(() -> counter.tryAcquire("rl:key:cred-1:5m", Duration.ofMinutes(5), 10))
                    .isInstanceOf(StoreUnavailableException.class);
            assertThat(store.gets.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("rate limiter and ceilings both survive a single store blip")
        void quotaComponents() {
            FlakyStore store = new FlakyStore(clock, 1, 1);
            FixedWindowCounter counter = new FixedWindowCounter(store, clock, new StoreRetrier(3, Duration.ZERO));
            MetricFactory metrics = new MetricFactory(new SimpleMeterRegistry(), "test");
            RateLimiter limiter = new RateLimiter(counter, new RateLimitPolicy(
                    List.of(new RateLimitRule(RateLimitDimension.API_KEY, RateLimitWindow.BURST, 5)), Map.of()),
                    metrics);
            CeilingEnforcer ceilings = new CeilingEnforcer(counter, CeilingPolicy.defaults(), metrics);

            var decision = limiter.checkAndIncrement(
                    new RateLimiter.Subject("cred-1", "t-1", TenantTier.FREE, "10.0.0.1"), "sample.echo");
            assertThat(decision.leases()).hasSize(1);

            store.getFailures.set(1);
            store.writeFailures.set(1);
            ceilings.enforce("t-1", "sample.echo");
        }
    }
}
