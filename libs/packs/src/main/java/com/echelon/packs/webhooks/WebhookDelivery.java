package com.echelon.packs.webhooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One delivery attempt of an event to a webhook.
 */
public record WebhookDelivery(
        @JsonProperty("delivery_id") String deliveryId,
        @JsonProperty("webhook_id") String webhookId,
        String event,
        String status,
        @JsonProperty("response_code") Integer responseCode,
        @JsonProperty("attempted_at") Instant attemptedAt) {
}
