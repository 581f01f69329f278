package com.echelon.packs.settings;

import com.echelon.kernel.json.Json;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SettingsRepository} holding one document per tenant. Stored documents are never
 * handed out; callers get deep copies.
 */
public class InMemorySettingsRepository implements SettingsRepository {

    private final Map<String, ObjectNode> settings = new ConcurrentHashMap<>();

    @Override
    public ObjectNode get(String tenantId) {
        ObjectNode current = settings.get(tenantId);
        return current == null ? Json.object() : current.deepCopy();
    }

    @Override
    public ObjectNode merge(String tenantId, ObjectNode patch) {
        ObjectNode merged = settings.compute(tenantId, (id, current) -> {
            ObjectNode next = current == null ? Json.object() : current.deepCopy();
            patch.fields().forEachRemaining(field -> {
                if (field.getValue().isNull()) {
                    next.remove(field.getKey());
                } else {
                    next.set(field.getKey(), field.getValue().deepCopy());
                }
            });
            return next;
        });
        return merged.deepCopy();
    }
}
