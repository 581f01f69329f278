package com.echelon.kernel.registry;

import java.util.List;

/**
 * Self-description of a pack.
 */
public record PackDescriptor(String namespace, String description, List<ActionDefinition> actions) {

    public PackDescriptor {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
