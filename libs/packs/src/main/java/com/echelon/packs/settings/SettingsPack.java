package com.echelon.packs.settings;

import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.registry.Action;
import com.echelon.kernel.registry.ActionContext;
import com.echelon.kernel.registry.ActionDefinition;
import com.echelon.kernel.registry.ActionResult;
import com.echelon.kernel.registry.FieldSchema;
import com.echelon.kernel.registry.Impact;
import com.echelon.kernel.registry.Pack;
import com.echelon.security.Scopes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Free-form per-tenant settings.
 */
public class SettingsPack implements Pack {

    public static final String NAMESPACE = "settings";
    public static final int MAX_KEYS_PER_UPDATE = 100;

    private final SettingsRepository settings;

    public SettingsPack(SettingsRepository settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String namespace() {
        return NAMESPACE;
    }

    @Override
    public String description() {
        return "Tenant settings";
    }

    @Override
    public List<Action> actions() {
        FieldSchema out = FieldSchema.object(Map.of("settings", FieldSchema.object()));
        return List.of(
                new Action(ActionDefinition.read("settings.get", Scopes.READ,
                        "Get tenant settings", FieldSchema.object(), out),
                        this::get),
                new Action(ActionDefinition.mutation("settings.update", Scopes.SETTINGS,
                        "Merge keys into the tenant settings; a null value removes the key",
                        FieldSchema.object(Map.of("settings", FieldSchema.object()), "settings"),
                        out),
                        this::update));
    }

    private ActionResult get(ActionContext ctx, JsonNode input) {
        return ActionResult.of(Map.of("settings", settings.get(ctx.tenantId())));
    }

    private ActionResult update(ActionContext ctx, JsonNode input) {
        ObjectNode patch = (ObjectNode) input.get("settings");
        if (patch.size() > MAX_KEYS_PER_UPDATE) {
            throw KernelException.invalidInput("settings may change at most " + MAX_KEYS_PER_UPDATE + " keys at once");
        }

        if (ctx.dryRun()) {
            ObjectNode current = settings.get(ctx.tenantId());
            List<String> changed = new ArrayList<>();
            patch.fields().forEachRemaining(field -> {
                JsonNode before = current.get(field.getKey());
                boolean removal = field.getValue().isNull();
                if (removal ? before != null : !field.getValue().equals(before)) {
                    changed.add("settings:" + ctx.tenantId() + "." + field.getKey());
                }
            });
            List<String> warnings = changed.isEmpty() ? List.of("No settings changed") : List.of();
            return ActionResult.dryRun(new Impact(null, changed, null, null, Impact.RISK_LOW, warnings));
        }

        return ActionResult.of(Map.of("settings", settings.merge(ctx.tenantId(), patch)));
    }
}
