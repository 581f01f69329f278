package com.echelon.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecretHasher and ApiKeys")
class SecretHasherTest {

    @Test
    @DisplayName("SHA-256 of a known value is the standard digest")
    void knownSha256() {
        assertThat(SecretHasher.sha256().hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("pepper changes the hash and blank pepper falls back to SHA-256")
    void pepperChangesHash() {
        var plain = SecretHasher.sha256();
        var peppered = SecretHasher.withPepper("pepper");
        assertThat(peppered.peppered()).isTrue();
        assertThat(peppered.hash("abc")).isNotEqualTo(plain.hash("abc")).hasSize(64);
        assertThat(SecretHasher.withPepper(" ").peppered()).isFalse();
    }

    @Test
    @DisplayName("matches() accepts the right secret only")
    void matches() {
        var hasher = SecretHasher.withPepper("p");
        String hash = hasher.hash("secret-1");
        assertThat(hasher.matches("secret-1", hash)).isTrue();
        assertThat(hasher.matches("secret-2", hash)).isFalse();
        assertThat(hasher.matches(null, hash)).isFalse();
    }

    @Test
    @DisplayName("generated keys carry the scheme prefix and a hash of the raw key")
    void generatedKeys() {
        var hasher = SecretHasher.sha256();
        IssuedApiKey key = ApiKeys.generate(hasher);
        assertThat(key.rawKey()).startsWith(ApiKeys.KEY_PREFIX);
        assertThat(key.prefix()).hasSize(ApiKeys.PREFIX_LENGTH);
        assertThat(ApiKeys.lookupPrefix(key.rawKey())).contains(key.prefix());
        assertThat(hasher.matches(key.rawKey(), key.hash())).isTrue();
        assertThat(key.toString()).doesNotContain(key.rawKey());
    }

    @Test
    @DisplayName("malformed keys have no lookup prefix")
    void malformedKeys() {
        assertThat(ApiKeys.lookupPrefix(null)).isEmpty();
        assertThat(ApiKeys.lookupPrefix("sk_live_abcdefghijkl")).isEmpty();
        assertThat(ApiKeys.lookupPrefix("ock_short")).isEmpty();
    }
}
