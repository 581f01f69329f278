package com.echelon.kernel.registry;

import java.util.List;

/**
 * Thrown when the registry cannot be built. Fatal at startup.
 */
public class RegistryConfigurationException extends RuntimeException {

    private final List<String> problems;

    public RegistryConfigurationException(List<String> problems) {
        super("Invalid pack registry: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
