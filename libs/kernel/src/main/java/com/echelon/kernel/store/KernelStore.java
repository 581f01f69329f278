package com.echelon.kernel.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value storage contract for kernel state: idempotency records and rate-limit buckets.
 * <p>
 * Values are opaque strings (JSON). Every mutation that the kernel relies on for correctness
 * under concurrency is either {@link #putIfAbsent} or {@link #compareAndSet}; implementations
 * must make both atomic per key. Expired entries behave as absent.
 * <p>
 * Any method may throw {@link StoreUnavailableException} for transient backend failures.
 */
public interface KernelStore {

    Optional<String> get(String key);

    /**
     * Stores the value only if no live entry exists for the key.
     *
     * @return true if the value was stored
     */
    boolean putIfAbsent(String key, String value, Duration ttl);

    /**
     * Replaces the value only if the current live value equals {@code expected}.
     *
     * @return true if the value was replaced
     */
    boolean compareAndSet(String key, String expected, String value, Duration ttl);

    /** Unconditionally stores the value. */
    void put(String key, String value, Duration ttl);

    void delete(String key);
}
