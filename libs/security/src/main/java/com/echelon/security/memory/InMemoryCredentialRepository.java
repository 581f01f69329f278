package com.echelon.security.memory;

import com.echelon.security.Credential;
import com.echelon.security.CredentialRepository;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CredentialRepository} backed by a {@link ConcurrentHashMap}.
 */
public class InMemoryCredentialRepository implements CredentialRepository {

    private final Map<String, Credential> credentials = new ConcurrentHashMap<>();

    @Override
    public List<Credential> findByPrefix(String keyPrefix) {
        return credentials.values().stream()
                .filter(c -> c.keyPrefix().equals(keyPrefix))
                .toList();
    }

    @Override
    public Optional<Credential> findById(String credentialId) {
        return Optional.ofNullable(credentials.get(credentialId));
    }

    @Override
    public List<Credential> listByTenant(String tenantId) {
        return credentials.values().stream()
                .filter(c -> c.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(Credential::createdAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public void save(Credential credential) {
        credentials.put(credential.credentialId(), credential);
    }

    @Override
    public void touch(String credentialId, Instant when) {
        credentials.computeIfPresent(credentialId, (id, c) -> c.withLastUsedAt(when));
    }

    @Override
    public Optional<Credential> revoke(String credentialId, Instant when) {
        return Optional.ofNullable(credentials.computeIfPresent(credentialId,
                (id, c) -> c.isRevoked() ? c : c.withRevokedAt(when)));
    }
}
