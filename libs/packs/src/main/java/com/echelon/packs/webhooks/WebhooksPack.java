package com.echelon.packs.webhooks;

import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.registry.Action;
import com.echelon.kernel.registry.ActionContext;
import com.echelon.kernel.registry.ActionDefinition;
import com.echelon.kernel.registry.ActionResult;
import com.echelon.kernel.registry.FieldSchema;
import com.echelon.kernel.registry.Impact;
import com.echelon.kernel.registry.Pack;
import com.echelon.packs.PackInputs;
import com.echelon.security.Scopes;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Webhook subscriptions and their delivery history.
 */
public class WebhooksPack implements Pack {

    public static final String NAMESPACE = "webhooks";
    public static final int DEFAULT_DELIVERY_LIMIT = 50;
    public static final int MAX_DELIVERY_LIMIT = 100;

    private static final String WEBHOOK = "webhook";
    private static final String INVALID_URL = "url must be an absolute http or https URL";

    private final WebhookRepository webhooks;

    public WebhooksPack(WebhookRepository webhooks) {
        this.webhooks = Objects.requireNonNull(webhooks, "webhooks");
    }

    @Override
    public String namespace() {
        return NAMESPACE;
    }

    @Override
    public String description() {
        return "Outbound webhook subscriptions";
    }

    @Override
    public List<Action> actions() {
        FieldSchema events = FieldSchema.array(FieldSchema.string());
        FieldSchema webhookOut = FieldSchema.object(Map.of(
                "webhook_id", FieldSchema.string(),
                "url", FieldSchema.string(),
                "events", events,
                "active", FieldSchema.bool()));
        FieldSchema byId = FieldSchema.object(Map.of("webhook_id", FieldSchema.string()), "webhook_id");

        return List.of(
                new Action(ActionDefinition.read("webhooks.list", Scopes.READ,
                        "List all webhooks for the tenant", FieldSchema.object(),
                        FieldSchema.object(Map.of(
                                "webhooks", FieldSchema.array(webhookOut),
                                "total", FieldSchema.integer()))),
                        this::list),
                new Action(ActionDefinition.mutation("webhooks.create", Scopes.WEBHOOKS,
                        "Create a new webhook",
                        FieldSchema.object(Map.of(
                                "url", FieldSchema.string().describedAs("http or https URL"),
                                "events", events,
                                "secret", FieldSchema.string()),
                                "url", "events"),
                        webhookOut),
                        this::create),
                new Action(ActionDefinition.mutation("webhooks.update", Scopes.WEBHOOKS,
                        "Update an existing webhook",
                        FieldSchema.object(Map.of(
                                "webhook_id", FieldSchema.string(),
                                "url", FieldSchema.string(),
                                "events", events,
                                "secret", FieldSchema.string(),
                                "active", FieldSchema.bool()),
                                "webhook_id"),
                        webhookOut),
                        this::update),
                new Action(ActionDefinition.mutation("webhooks.delete", Scopes.WEBHOOKS,
                        "Delete a webhook", byId,
                        FieldSchema.object(Map.of(
                                "webhook_id", FieldSchema.string(),
                                "deleted", FieldSchema.bool()))),
                        this::delete),
                new Action(ActionDefinition.read("webhooks.deliveries", Scopes.READ,
                        "List recent delivery attempts for a webhook",
                        FieldSchema.object(Map.of(
                                "webhook_id", FieldSchema.string(),
                                "limit", FieldSchema.integer().min(1).max(MAX_DELIVERY_LIMIT)
                                        .describedAs("defaults to " + DEFAULT_DELIVERY_LIMIT)),
                                "webhook_id"),
                        FieldSchema.object(Map.of(
                                "deliveries", FieldSchema.array(FieldSchema.object()),
                                "total", FieldSchema.integer()))),
                        this::deliveries));
    }

    private ActionResult list(ActionContext ctx, JsonNode input) {
        List<WebhookView> views = webhooks.listByTenant(ctx.tenantId()).stream()
                .map(WebhookView::of)
                .toList();
        return ActionResult.of(Map.of("webhooks", views, "total", views.size()));
    }

    private ActionResult create(ActionContext ctx, JsonNode input) {
        String url = requireUrl(PackInputs.text(input, "url"));
        List<String> events = requireEvents(PackInputs.textList(input, "events"));
        String secret = PackInputs.text(input, "secret");

        if (ctx.dryRun()) {
            Impact impact = Impact.creates(WEBHOOK + ":" + url, Impact.RISK_LOW);
            if (secret == null) {
                impact = impact.withWarning("Deliveries will not be signed without a secret");
            }
            return ActionResult.dryRun(impact);
        }

        Instant now = ctx.clock().instant();
        Webhook webhook = new Webhook("wh_" + UUID.randomUUID().toString().replace("-", ""),
                ctx.tenantId(), url, events, secret, true, now, now);
        webhooks.save(webhook);
        return ActionResult.of(WebhookView.of(webhook));
    }

    private ActionResult update(ActionContext ctx, JsonNode input) {
        Webhook existing = owned(ctx, PackInputs.text(input, "webhook_id"));
        String url = PackInputs.has(input, "url") ? requireUrl(PackInputs.text(input, "url")) : existing.url();
        List<String> events = PackInputs.has(input, "events")
                ? requireEvents(PackInputs.textList(input, "events")) : existing.events();
        String secret = PackInputs.has(input, "secret") ? PackInputs.text(input, "secret") : existing.secret();
        boolean active = PackInputs.has(input, "active") ? input.get("active").asBoolean() : existing.active();

        if (ctx.dryRun()) {
            String id = WEBHOOK + ":" + existing.webhookId();
            List<String> changed = new ArrayList<>();
            if (!url.equals(existing.url())) {
                changed.add(id + ".url");
            }
            if (!events.equals(existing.events())) {
                changed.add(id + ".events");
            }
            if (PackInputs.has(input, "secret")) {
                changed.add(id + ".secret");
            }
            if (active != existing.active()) {
                changed.add(id + ".active");
            }
            List<String> warnings = changed.isEmpty() ? List.of("No fields changed") : List.of();
            return ActionResult.dryRun(new Impact(null, changed, null, null, Impact.RISK_LOW, warnings));
        }

        Webhook updated = existing.withChanges(url, events, secret, active, ctx.clock().instant());
        webhooks.save(updated);
        return ActionResult.of(WebhookView.of(updated));
    }

    private ActionResult delete(ActionContext ctx, JsonNode input) {
        Webhook existing = owned(ctx, PackInputs.text(input, "webhook_id"));

        if (ctx.dryRun()) {
            return ActionResult.dryRun(Impact.deletes(WEBHOOK + ":" + existing.webhookId(), Impact.RISK_LOW)
                    .withWarning("Delivery history for this webhook is deleted too"));
        }

        webhooks.delete(existing.webhookId());
        return ActionResult.of(Map.of("webhook_id", existing.webhookId(), "deleted", true));
    }

    private ActionResult deliveries(ActionContext ctx, JsonNode input) {
        Webhook webhook = owned(ctx, PackInputs.text(input, "webhook_id"));
        int limit = PackInputs.integer(input, "limit", DEFAULT_DELIVERY_LIMIT);
        List<WebhookDelivery> recent = webhooks.listDeliveries(webhook.webhookId(), limit);
        return ActionResult.of(Map.of("deliveries", recent, "total", recent.size()));
    }

    private Webhook owned(ActionContext ctx, String webhookId) {
        Webhook webhook = webhooks.findById(webhookId)
                .orElseThrow(() -> KernelException.resourceNotFound("Webhook", webhookId));
        ctx.requireOwned(webhook.tenantId(), "Webhook", webhookId);
        return webhook;
    }

    private static String requireUrl(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw KernelException.invalidInput(INVALID_URL);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw KernelException.invalidInput(INVALID_URL);
        }
        return url;
    }

    private static List<String> requireEvents(List<String> events) {
        if (events.isEmpty()) {
            throw KernelException.invalidInput("events must not be empty");
        }
        for (String event : events) {
            if (event.isBlank()) {
                throw KernelException.invalidInput("events must not contain blank names");
            }
        }
        return List.copyOf(events);
    }
}
