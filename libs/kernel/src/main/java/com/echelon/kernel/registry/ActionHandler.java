package com.echelon.kernel.registry;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executes one action. Input has already passed schema validation.
 * <p>
 * Handlers may throw {@link com.echelon.kernel.error.KernelException} for expected failures;
 * anything else is reported to the caller as {@code INTERNAL_ERROR}.
 */
@FunctionalInterface
public interface ActionHandler {

    ActionResult handle(ActionContext context, JsonNode input) throws Exception;
}
