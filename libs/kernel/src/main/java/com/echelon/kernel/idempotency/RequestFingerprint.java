package com.echelon.kernel.idempotency;

import com.echelon.kernel.json.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * SHA-256 of the canonical (sorted-key) JSON of action name plus payload.
 * Key order in the payload does not change the fingerprint.
 */
public final class RequestFingerprint {

    private RequestFingerprint() {
        // utility class
    }

    public static String of(String action, JsonNode payload) {
        ObjectNode envelope = Json.object();
        envelope.put("action", action);
        envelope.set("payload", payload == null ? Json.object() : payload);
        return Json.sha256Hex(Json.canonical(envelope));
    }
}
