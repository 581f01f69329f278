package com.echelon.kernel.registry;

import com.echelon.kernel.json.Json;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a handler returns: the response data, plus the impact description on dry runs.
 */
public record ActionResult(JsonNode data, Impact impact) {

    public static ActionResult of(Object data) {
        return new ActionResult(Json.toTree(data), null);
    }

    /**
     * A dry-run result. The impact is also embedded in {@code data} under {@code impact}.
     */
    public static ActionResult dryRun(Impact impact) {
        var data = Json.object();
        data.put("dry_run", true);
        data.set("impact", Json.toTree(impact));
        return new ActionResult(data, impact);
    }
}
