package com.echelon.packs.settings;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Storage port for per-tenant settings documents.
 */
public interface SettingsRepository {

    /** Returns a copy of the tenant's settings; empty when none were ever stored. */
    ObjectNode get(String tenantId);

    /**
     * Shallow-merges the patch into the tenant's settings. A JSON null removes the key.
     *
     * @return a copy of the settings after the merge
     */
    ObjectNode merge(String tenantId, ObjectNode patch);
}
