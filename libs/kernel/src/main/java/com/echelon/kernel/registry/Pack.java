package com.echelon.kernel.registry;

import java.util.List;

/**
 * A namespaced group of actions.
 * <p>
 * Packs are plain values composed into the {@link PackRegistry} at startup; every action
 * name must start with {@code namespace() + "."}.
 */
public interface Pack {

    String namespace();

    List<Action> actions();

    default String description() {
        return "";
    }

    default PackDescriptor describe() {
        return new PackDescriptor(namespace(), description(),
                actions().stream().map(Action::definition).toList());
    }
}
