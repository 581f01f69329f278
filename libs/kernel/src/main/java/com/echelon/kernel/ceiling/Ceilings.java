package com.echelon.kernel.ceiling;

import java.util.Map;

/**
 * Hard ceilings compiled into the kernel.
 * <p>
 * WHY constants: ceilings are the last line of defence against runaway callers and must hold
 * regardless of tier or configuration. Configuration may lower them, never raise them.
 */
public final class Ceilings {

    /** Maximum actions per tenant per second, across all keys. */
    public static final long TENANT_ACTIONS_PER_SECOND = 50;

    /** Maximum executions per tenant per day, for actions that create durable resources. */
    public static final Map<String, Long> ACTION_DAILY = Map.of(
            "iam.keys.create", 25L,
            "webhooks.create", 20L);

    private Ceilings() {
        // utility class
    }
}
