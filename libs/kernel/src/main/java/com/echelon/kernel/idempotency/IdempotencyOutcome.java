package com.echelon.kernel.idempotency;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of {@link IdempotencyStore#checkOrReserve}.
 *
 * @param kind        what happened
 * @param reservation the reservation taken (MISS only)
 * @param cached      the cached response data (HIT only)
 */
public record IdempotencyOutcome(Kind kind, Reservation reservation, JsonNode cached) {

    public enum Kind {
        /** Reservation taken; the caller must complete or release it. */
        MISS,
        /** A completed record with the same fingerprint exists. */
        HIT,
        /** The key was used with a different fingerprint. */
        CONFLICT,
        /** Another request with the same key is still executing after the bounded wait. */
        IN_FLIGHT
    }

    static IdempotencyOutcome miss(Reservation reservation) {
        return new IdempotencyOutcome(Kind.MISS, reservation, null);
    }

    static IdempotencyOutcome hit(JsonNode cached) {
        return new IdempotencyOutcome(Kind.HIT, null, cached);
    }

    static IdempotencyOutcome conflict() {
        return new IdempotencyOutcome(Kind.CONFLICT, null, null);
    }

    static IdempotencyOutcome inFlight() {
        return new IdempotencyOutcome(Kind.IN_FLIGHT, null, null);
    }

    /**
     * A held reservation.
     *
     * @param storeKey store key of the record
     * @param record   the in-flight record as written
     * @param json     its serialized form, used as the compare-and-set expectation
     */
    public record Reservation(String storeKey, IdempotencyRecord record, String json) {
    }
}
