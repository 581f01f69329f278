package com.echelon.security.memory;

import com.echelon.security.VerificationToken;
import com.echelon.security.VerificationTokenRepository;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link VerificationTokenRepository} backed by a {@link ConcurrentHashMap}.
 * Consumption uses {@link Map#replace(Object, Object, Object)} as the compare-and-set.
 */
public class InMemoryVerificationTokenRepository implements VerificationTokenRepository {

    private final Map<String, VerificationToken> tokens = new ConcurrentHashMap<>();

    @Override
    public void save(VerificationToken token) {
        tokens.put(token.tokenHash(), token);
    }

    @Override
    public Optional<VerificationToken> findByHash(String tokenHash) {
        return Optional.ofNullable(tokens.get(tokenHash));
    }

    @Override
    public boolean markConsumed(String tokenHash, Instant when) {
        VerificationToken current = tokens.get(tokenHash);
        if (current == null || current.isConsumed()) {
            return false;
        }
        return tokens.replace(tokenHash, current, current.consume(when));
    }

    @Override
    public boolean restoreConsumed(String tokenHash, Instant when) {
        VerificationToken current = tokens.get(tokenHash);
        if (current == null || !when.equals(current.consumedAt())) {
            return false;
        }
        return tokens.replace(tokenHash, current, current.consume(null));
    }
}
