package com.echelon.kernel.registry;

import com.echelon.kernel.json.Json;
import com.echelon.security.Scopes;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/**
 * Built-in discovery pack: {@code meta.actions} and {@code meta.version}.
 * Both need only {@code manage.discover}, so unverified tenants can discover capabilities.
 */
final class MetaPack implements Pack {

    static final String NAMESPACE = "meta";
    static final String API_VERSION = "v1";
    static final String SCHEMA_VERSION = "2026-02-11";

    private volatile PackRegistry registry;

    void bind(PackRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String namespace() {
        return NAMESPACE;
    }

    @Override
    public String description() {
        return "Capability discovery";
    }

    @Override
    public List<Action> actions() {
        return List.of(
                new Action(ActionDefinition.read(
                        "meta.actions", Scopes.DISCOVER,
                        "List every registered action with its schemas and required scope",
                        FieldSchema.object(),
                        FieldSchema.object(Map.of(
                                "actions", FieldSchema.array(FieldSchema.object()),
                                "total", FieldSchema.integer()))),
                        (ctx, input) -> listActions()),
                new Action(ActionDefinition.read(
                        "meta.version", Scopes.DISCOVER,
                        "Report API version, schema version and action count",
                        FieldSchema.object(),
                        FieldSchema.object(Map.of(
                                "api_version", FieldSchema.string(),
                                "schema_version", FieldSchema.string(),
                                "actions_count", FieldSchema.integer()))),
                        (ctx, input) -> version()));
    }

    private ActionResult listActions() {
        ArrayNode list = Json.mapper().createArrayNode();
        for (ActionDefinition def : registry.definitions()) {
            ObjectNode entry = list.addObject();
            entry.put("name", def.name());
            entry.put("description", def.description());
            entry.put("scope", def.requiredScope());
            entry.put("side_effecting", def.sideEffecting());
            entry.put("supports_dry_run", def.supportsDryRun());
            entry.set("input_schema", Json.toTree(def.inputSchema()));
            entry.set("output_schema", Json.toTree(def.outputSchema()));
        }
        ObjectNode data = Json.object();
        data.set("actions", list);
        data.put("total", list.size());
        return new ActionResult(data, null);
    }

    private ActionResult version() {
        ObjectNode data = Json.object();
        data.put("api_version", API_VERSION);
        data.put("schema_version", SCHEMA_VERSION);
        data.put("actions_count", registry.size());
        return new ActionResult(data, null);
    }
}
