package com.echelon.packs.webhooks;

import java.time.Instant;
import java.util.List;

/**
 * A tenant's webhook subscription.
 *
 * @param webhookId opaque identifier
 * @param tenantId  owning tenant
 * @param url       http(s) endpoint
 * @param events    subscribed event names
 * @param secret    signing secret, never returned to callers (nullable)
 * @param active    deliveries are attempted only while active
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
public record Webhook(
        String webhookId,
        String tenantId,
        String url,
        List<String> events,
        String secret,
        boolean active,
        Instant createdAt,
        Instant updatedAt) {

    public Webhook {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public Webhook withChanges(String newUrl, List<String> newEvents, String newSecret, boolean newActive,
                               Instant when) {
        return new Webhook(webhookId, tenantId, newUrl, newEvents, newSecret, newActive, createdAt, when);
    }
}
