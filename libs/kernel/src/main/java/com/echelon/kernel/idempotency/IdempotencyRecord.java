package com.echelon.kernel.idempotency;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Stored state of one idempotency key.
 *
 * @param state         in flight or completed
 * @param reservationId unique per reservation, so only the owner completes or releases it
 * @param fingerprint   request fingerprint the key was first used with
 * @param action        action name
 * @param response      response data of the completed request (null while in flight)
 * @param createdAt     reservation time
 */
public record IdempotencyRecord(
        State state,
        String reservationId,
        String fingerprint,
        String action,
        JsonNode response,
        Instant createdAt) {

    public enum State {
        IN_FLIGHT,
        COMPLETED
    }

    public boolean completed() {
        return state == State.COMPLETED;
    }

    public IdempotencyRecord complete(JsonNode data) {
        return new IdempotencyRecord(State.COMPLETED, reservationId, fingerprint, action, data, createdAt);
    }
}
