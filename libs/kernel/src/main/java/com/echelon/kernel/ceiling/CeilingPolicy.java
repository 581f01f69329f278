package com.echelon.kernel.ceiling;

import java.util.Map;

/**
 * Configured ceilings. Values above the constants in {@link Ceilings} are clamped by
 * {@link CeilingEnforcer}.
 *
 * @param tenantActionsPerSecond configured per-tenant per-second ceiling
 * @param actionDaily            configured per-action daily ceilings
 */
public record CeilingPolicy(long tenantActionsPerSecond, Map<String, Long> actionDaily) {

    public CeilingPolicy {
        if (tenantActionsPerSecond <= 0) {
            tenantActionsPerSecond = Ceilings.TENANT_ACTIONS_PER_SECOND;
        }
        actionDaily = actionDaily == null ? Map.of() : Map.copyOf(actionDaily);
    }

    /** The hard constants themselves. */
    public static CeilingPolicy defaults() {
        return new CeilingPolicy(Ceilings.TENANT_ACTIONS_PER_SECOND, Ceilings.ACTION_DAILY);
    }
}
