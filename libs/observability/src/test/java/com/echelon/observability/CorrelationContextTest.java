package com.echelon.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("rejects a blank correlation ID")
    void rejectsBlankCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
        assertThatThrownBy(() -> new CorrelationContext(null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("withIdentity keeps request fields and sets tenant and actor")
    void withIdentityKeepsRequestFields() {
        var ctx = new CorrelationContext("corr-1", null, null, "req-1", "settings.get");

        var resolved = ctx.withIdentity("tenant-9", "key-9");

        assertThat(resolved.correlationId()).isEqualTo("corr-1");
        assertThat(resolved.requestId()).isEqualTo("req-1");
        assertThat(resolved.action()).isEqualTo("settings.get");
        assertThat(resolved.tenantId()).isEqualTo("tenant-9");
        assertThat(resolved.actorId()).isEqualTo("key-9");
    }
}
