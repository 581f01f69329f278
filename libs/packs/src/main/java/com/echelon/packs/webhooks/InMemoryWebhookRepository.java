package com.echelon.packs.webhooks;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link WebhookRepository} backed by concurrent maps.
 */
public class InMemoryWebhookRepository implements WebhookRepository {

    private final Map<String, Webhook> webhooks = new ConcurrentHashMap<>();
    private final Map<String, List<WebhookDelivery>> deliveries = new ConcurrentHashMap<>();

    @Override
    public List<Webhook> listByTenant(String tenantId) {
        return webhooks.values().stream()
                .filter(w -> w.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(Webhook::createdAt))
                .toList();
    }

    @Override
    public Optional<Webhook> findById(String webhookId) {
        return Optional.ofNullable(webhooks.get(webhookId));
    }

    @Override
    public void save(Webhook webhook) {
        webhooks.put(webhook.webhookId(), webhook);
    }

    @Override
    public boolean delete(String webhookId) {
        deliveries.remove(webhookId);
        return webhooks.remove(webhookId) != null;
    }

    @Override
    public void recordDelivery(WebhookDelivery delivery) {
        deliveries.computeIfAbsent(delivery.webhookId(), id -> new CopyOnWriteArrayList<>()).add(delivery);
    }

    @Override
    public List<WebhookDelivery> listDeliveries(String webhookId, int limit) {
        List<WebhookDelivery> all = new ArrayList<>(deliveries.getOrDefault(webhookId, List.of()));
        all.sort(Comparator.comparing(WebhookDelivery::attemptedAt).reversed());
        return all.subList(0, Math.min(limit, all.size()));
    }
}
