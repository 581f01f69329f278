package com.echelon.packs.webhooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * What callers see of a webhook. The secret is reduced to whether one is set.
 */
public record WebhookView(
        @JsonProperty("webhook_id") String webhookId,
        String url,
        List<String> events,
        boolean active,
        @JsonProperty("has_secret") boolean hasSecret,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static WebhookView of(Webhook webhook) {
        return new WebhookView(webhook.webhookId(), webhook.url(), webhook.events(), webhook.active(),
                webhook.secret() != null, webhook.createdAt(), webhook.updatedAt());
    }
}
