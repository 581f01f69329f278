package com.echelon.kernel.registry;

/**
 * A registered action: its definition plus the handler that executes it.
 */
public record Action(ActionDefinition definition, ActionHandler handler) {

    public String name() {
        return definition.name();
    }
}
