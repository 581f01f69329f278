package com.echelon.kernel.store;

import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries store operations that fail with {@link StoreUnavailableException}, with exponential
 * backoff and a bounded number of attempts.
 * <p>
 * Only used for storage calls made before a handler runs. Once side effects may have happened,
 * callers write once and log failures instead.
 */
public class StoreRetrier {

    private static final Logger log = LoggerFactory.getLogger(StoreRetrier.class);

    private final int maxAttempts;
    private final Duration initialBackoff;

    public StoreRetrier(int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
    }

    /** Single attempt, no backoff. */
    public static StoreRetrier none() {
        return new StoreRetrier(1, Duration.ZERO);
    }

    /**
     * Runs the operation, retrying on {@link StoreUnavailableException}.
     *
     * @throws StoreUnavailableException when every attempt failed
     */
    public <T> T execute(String operation, Supplier<T> action) {
        long backoffMillis = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.error("Store operation '{}' failed after {} attempts", operation, attempt, e);
                    throw e;
                }
                log.warn("Store operation '{}' failed (attempt {}/{}), retrying in {} ms",
                        operation, attempt, maxAttempts, backoffMillis);
                sleep(backoffMillis);
                backoffMillis *= 2;
            }
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while backing off", e);
        }
    }
}
