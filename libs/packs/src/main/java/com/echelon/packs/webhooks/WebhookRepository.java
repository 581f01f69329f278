package com.echelon.packs.webhooks;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for webhooks and their delivery history.
 */
public interface WebhookRepository {

    List<Webhook> listByTenant(String tenantId);

    Optional<Webhook> findById(String webhookId);

    void save(Webhook webhook);

    /** Deletes the webhook and its delivery history. */
    boolean delete(String webhookId);

    void recordDelivery(WebhookDelivery delivery);

    /** Most recent deliveries first. */
    List<WebhookDelivery> listDeliveries(String webhookId, int limit);
}
