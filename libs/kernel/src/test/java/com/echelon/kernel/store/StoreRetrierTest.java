package com.echelon.kernel.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StoreRetrier")
class StoreRetrierTest {

    @Test
    @DisplayName("retries transient failures and returns the eventual result")
    void retriesUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        StoreRetrier retrier = new StoreRetrier(3, Duration.ofMillis(1));

        String result = retrier.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new StoreUnavailableException("down");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("gives up after the configured attempts")
    void boundedAttempts() {
        AtomicInteger calls = new AtomicInteger();
        StoreRetrier retrier = new StoreRetrier(2, Duration.ZERO);

        assertThatThrownBy(() -> retrier.execute("op", () -> {
            calls.incrementAndGet();
            throw new StoreUnavailableException("down");
        })).isInstanceOf(StoreUnavailableException.class);
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("does not retry other exceptions")
    void otherExceptionsPropagate() {
        AtomicInteger calls = new AtomicInteger();
        StoreRetrier retrier = new StoreRetrier(5, Duration.ZERO);

        assertThatThrownBy(() -> retrier.execute("op", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(calls).hasValue(1);
    }
}
