package com.echelon.kernel.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.error.ResponseStatus;
import com.echelon.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditLog")
class AuditLogTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricFactory metrics = new MetricFactory(registry, "test");

    private static AuditEntry entry(String requestId) {
        return new AuditEntry("evt-" + requestId, requestId, Instant.now(), "t-1", "cred-1", "x.read", "x",
                ResponseStatus.ALLOWED, ErrorCodes.OK, Map.of(), "hash", null, null, null, false, 1);
    }

    @Test
    @DisplayName("entries reach the sink in order, written behind the caller")
    void writeBehind() {
        InMemoryAuditSink sink = new InMemoryAuditSink();
        try (AuditLog log = new AuditLog(sink, 100, Duration.ofMillis(10), metrics)) {
            log.record(entry("r1"));
            log.record(entry("r2"));

            assertThat(log.flush(Duration.ofSeconds(5))).isTrue();
            assertThat(sink.entries()).extracting(AuditEntry::requestId).containsExactly("r1", "r2");
        }
    }

    @Test
    @DisplayName("a failing sink never fails the caller and is counted")
    void failingSink() {
        AuditSink failing = e -> {
            throw new IllegalStateException("disk full");
        };
        try (AuditLog log = new AuditLog(failing, 100, Duration.ofMillis(10), metrics)) {
            assertThatCode(() -> log.record(entry("r1"))).doesNotThrowAnyException();
            assertThat(log.flush(Duration.ofSeconds(5))).isTrue();
        }
        assertThat(registry.get("echelon.audit.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a full queue drops to the fallback logger instead of blocking")
    void fullQueue() throws Exception {
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        AuditSink slow = e -> {
            entered.countDown();
            blocked.await(5, TimeUnit.SECONDS);
        };
        try (AuditLog log = new AuditLog(slow, 1, Duration.ofMillis(10), metrics)) {
            log.record(entry("r1"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            log.record(entry("r2"));
            log.record(entry("r3"));

            assertThat(registry.get("echelon.audit.dropped").counter().count()).isEqualTo(1.0);
            blocked.countDown();
            assertThat(log.flush(Duration.ofSeconds(5))).isTrue();
        }
    }
}
