package com.echelon.kernel.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link KernelStore} backed by a {@link ConcurrentHashMap}, with lazy TTL expiry against an
 * injected {@link Clock}. Atomic operations run inside {@code compute} so they serialize per key.
 */
public class InMemoryKernelStore implements KernelStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKernelStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiredAt(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        boolean[] stored = {false};
        entries.compute(key, (k, current) -> {
            if (current != null && !current.expiredAt(now)) {
                return current;
            }
            stored[0] = true;
            return new Entry(value, expiry(now, ttl));
        });
        return stored[0];
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value, Duration ttl) {
        Instant now = clock.instant();
        boolean[] swapped = {false};
        entries.compute(key, (k, current) -> {
            String live = current == null || current.expiredAt(now) ? null : current.value();
            if (!Objects.equals(live, expected)) {
                return current;
            }
            swapped[0] = true;
            return new Entry(value, expiry(now, ttl));
        });
        return swapped[0];
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiry(clock.instant(), ttl)));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    /** Number of stored entries, including expired ones not yet evicted. */
    public int size() {
        return entries.size();
    }

    private static Instant expiry(Instant now, Duration ttl) {
        return ttl == null ? null : now.plus(ttl);
    }

    private record Entry(String value, Instant expiresAt) {
        boolean expiredAt(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
