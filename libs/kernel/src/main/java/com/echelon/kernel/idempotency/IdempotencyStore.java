package com.echelon.kernel.idempotency;

import com.echelon.kernel.json.Json;
import com.echelon.kernel.store.KernelStore;
import com.echelon.kernel.store.StoreRetrier;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deduplicates side-effecting requests by (tenant, idempotency key).
 * <p>
 * A reservation is written with {@code putIfAbsent}, so among concurrent requests with the same
 * key exactly one gets {@code MISS} and executes. The others see the in-flight record and poll
 * until it completes (then {@code HIT}) or the bounded wait runs out ({@code IN_FLIGHT}).
 * In-flight records carry a short TTL so a crashed owner cannot block the key for a full day.
 */
public class IdempotencyStore {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyStore.class);

    private static final String KEY_PREFIX = "idem:";

    private final KernelStore store;
    private final Clock clock;
    private final StoreRetrier retrier;
    private final Duration ttl;
    private final Duration inFlightTtl;
    private final Duration maxWait;
    private final Duration pollInterval;

    public IdempotencyStore(KernelStore store, Clock clock, StoreRetrier retrier, Duration ttl,
                            Duration inFlightTtl, Duration maxWait, Duration pollInterval) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retrier = retrier == null ? StoreRetrier.none() : retrier;
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.inFlightTtl = Objects.requireNonNull(inFlightTtl, "inFlightTtl");
        this.maxWait = Objects.requireNonNull(maxWait, "maxWait");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    /**
     * Checks the key and reserves it if unused.
     */
    public IdempotencyOutcome checkOrReserve(String tenantId, String idempotencyKey, String action,
                                             String fingerprint) {
        String storeKey = KEY_PREFIX + tenantId + ":" + idempotencyKey;
        long deadline = System.nanoTime() + maxWait.toNanos();
        IdempotencyRecord reservation = new IdempotencyRecord(IdempotencyRecord.State.IN_FLIGHT,
                UUID.randomUUID().toString(), fingerprint, action, null, clock.instant());
        String reservationJson = Json.write(reservation);

        while (true) {
            boolean reserved = retrier.execute("idempotency.reserve",
                    () -> store.putIfAbsent(storeKey, reservationJson, inFlightTtl));
            if (reserved) {
                return IdempotencyOutcome.miss(
                        new IdempotencyOutcome.Reservation(storeKey, reservation, reservationJson));
            }
            Optional<String> existing = retrier.execute("idempotency.get", () -> store.get(storeKey));
            if (existing.isEmpty()) {
                // expired or released between the two calls
                continue;
            }
            IdempotencyRecord record = Json.read(existing.get(), IdempotencyRecord.class);
            if (!record.fingerprint().equals(fingerprint)) {
                log.warn("Idempotency key reused with a different request: tenant={} action={}",
                        tenantId, action);
                return IdempotencyOutcome.conflict();
            }
            if (record.completed()) {
                log.debug("Idempotency hit: tenant={} action={}", tenantId, action);
                return IdempotencyOutcome.hit(record.response());
            }
            if (System.nanoTime() >= deadline) {
                return IdempotencyOutcome.inFlight();
            }
            pause();
        }
    }

    /**
     * Stores the response of a reserved request. Attempted once; the caller logs failures.
     *
     * @return false if the reservation was lost (expired or taken over)
     */
    public boolean complete(IdempotencyOutcome.Reservation reservation, JsonNode response) {
        String completed = Json.write(reservation.record().complete(response));
        return store.compareAndSet(reservation.storeKey(), reservation.json(), completed, ttl);
    }

    /**
     * Drops a reservation so a retry can execute. Only removes the record if it is still this
     * reservation.
     */
    public void release(IdempotencyOutcome.Reservation reservation) {
        try {
            Optional<String> current = store.get(reservation.storeKey());
            if (current.isPresent() && current.get().equals(reservation.json())) {
                store.delete(reservation.storeKey());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release idempotency reservation {}", reservation.storeKey(), e);
        }
    }

    private void pause() {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(1, pollInterval.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for in-flight request", e);
        }
    }
}
