package com.echelon.kernel.json;

import static org.assertj.core.api.Assertions.assertThat;

import com.echelon.kernel.idempotency.RequestFingerprint;
import com.echelon.kernel.support.Payloads;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Json canonical form and fingerprints")
class JsonTest {

    @Test
    @DisplayName("canonical form sorts keys at every level")
    void sortsKeys() {
        String canonical = Json.canonical(Payloads.json("{\"b\":1,\"a\":{\"d\":[1,2],\"c\":true}}"));
        assertThat(canonical).isEqualTo("{\"a\":{\"c\":true,\"d\":[1,2]},\"b\":1}");
    }

    @Test
    @DisplayName("fingerprint ignores key order but not values or action")
    void fingerprint() {
        String a = RequestFingerprint.of("x.create", Payloads.json("{\"name\":\"n\",\"size\":2}"));
        String b = RequestFingerprint.of("x.create", Payloads.json("{\"size\":2,\"name\":\"n\"}"));
        String c = RequestFingerprint.of("x.create", Payloads.json("{\"size\":3,\"name\":\"n\"}"));
        String d = RequestFingerprint.of("x.update", Payloads.json("{\"size\":2,\"name\":\"n\"}"));

        assertThat(a).isEqualTo(b).hasSize(64);
        assertThat(a).isNotEqualTo(c).isNotEqualTo(d);
    }
}
