package com.echelon.kernel.ratelimit;

import com.echelon.kernel.json.Json;
import com.echelon.kernel.store.KernelStore;
import com.echelon.kernel.store.StoreRetrier;
import com.echelon.kernel.store.StoreUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Atomic check-and-increment over {@link WindowBucket}s stored in a {@link KernelStore}.
 * <p>
 * Each operation is a compare-and-set loop over the serialized bucket, so concurrent callers
 * on the same key can never take more than {@code limit} increments per window. Windows reset
 * lazily: the first caller after the window has elapsed starts a new one at the current time.
 * Store reads and writes made while acquiring go through the {@link StoreRetrier}.
 */
public class FixedWindowCounter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowCounter.class);

    private static final int MAX_CAS_ATTEMPTS = 128;

    private final KernelStore store;
    private final Clock clock;
    private final StoreRetrier retrier;

    public FixedWindowCounter(KernelStore store, Clock clock) {
        this(store, clock, StoreRetrier.none());
    }

    public FixedWindowCounter(KernelStore store, Clock clock, StoreRetrier retrier) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retrier = retrier == null ? StoreRetrier.none() : retrier;
    }

    /**
     * Outcome of an acquisition attempt.
     *
     * @param allowed           whether the increment was taken
     * @param count             count in the window after the attempt
     * @param limit             the limit applied
     * @param retryAfterSeconds seconds until the window resets (0 when allowed)
     * @param lease             the increment taken, null when rejected
     */
    public record Acquisition(boolean allowed, long count, long limit, long retryAfterSeconds,
                              WindowLease lease) {

        public long remaining() {
            return Math.max(0, limit - count);
        }
    }

    /**
     * Increments the bucket unless doing so would exceed {@code limit}.
     */
    public Acquisition tryAcquire(String key, Duration window, long limit) {
        long windowMillis = window.toMillis();
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            long now = clock.millis();
            Optional<String> raw = retrier.execute("counter.get", () -> store.get(key));
            WindowBucket current = raw.map(json -> Json.read(json, WindowBucket.class))
                    .filter(b -> now < b.windowStart() + windowMillis)
                    .orElse(new WindowBucket(now, 0));
            if (current.count() + 1 > limit) {
                long retryAfterMillis = current.windowStart() + windowMillis - now;
                return new Acquisition(false, current.count(), limit,
                        Math.max(1, (retryAfterMillis + 999) / 1000), null);
            }
            WindowBucket next = new WindowBucket(current.windowStart(), current.count() + 1);
            String nextJson = Json.write(next);
            boolean stored = raw.isPresent()
                    ? retrier.execute("counter.cas", () -> store.compareAndSet(key, raw.get(), nextJson, window))
                    : retrier.execute("counter.put", () -> store.putIfAbsent(key, nextJson, window));
            if (stored) {
                return new Acquisition(true, next.count(), limit, 0,
                        new WindowLease(key, next.windowStart(), window));
            }
        }
        throw new StoreUnavailableException("Contention on counter " + key);
    }

    /**
     * Current count in the live window, without incrementing.
     */
    public long peek(String key, Duration window) {
        long now = clock.millis();
        return retrier.execute("counter.get", () -> store.get(key))
                .map(json -> Json.read(json, WindowBucket.class))
                .filter(b -> now < b.windowStart() + window.toMillis())
                .map(WindowBucket::count)
                .orElse(0L);
    }

    /**
     * Hands back an increment, provided its window is still the live one.
     * Failures are logged; a lost compensation only over-counts.
     */
    public void release(WindowLease lease) {
        try {
            for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
                Optional<String> raw = store.get(lease.key());
                if (raw.isEmpty()) {
                    return;
                }
                WindowBucket current = Json.read(raw.get(), WindowBucket.class);
                if (current.windowStart() != lease.windowStart() || current.count() == 0) {
                    return;
                }
                WindowBucket next = new WindowBucket(current.windowStart(), current.count() - 1);
                if (store.compareAndSet(lease.key(), raw.get(), Json.write(next), lease.window())) {
                    return;
                }
            }
            log.warn("Gave up compensating counter {} after contention", lease.key());
        } catch (RuntimeException e) {
            log.warn("Failed to compensate counter {}", lease.key(), e);
        }
    }
}
