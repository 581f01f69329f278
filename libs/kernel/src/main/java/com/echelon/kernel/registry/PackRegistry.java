package com.echelon.kernel.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable index of every registered action, built once at startup.
 * <p>
 * The built-in {@link MetaPack} is always registered first. Any configuration problem
 * (duplicate names, actions outside their pack's namespace, missing handler, scope or schema)
 * is collected and reported in one {@link RegistryConfigurationException}.
 */
public final class PackRegistry {

    private static final Logger log = LoggerFactory.getLogger(PackRegistry.class);

    private final Map<String, Action> actions;
    private final List<PackDescriptor> packs;

    private PackRegistry(Map<String, Action> actions, List<PackDescriptor> packs) {
        this.actions = Collections.unmodifiableMap(actions);
        this.packs = List.copyOf(packs);
    }

    /**
     * Builds the registry from the enabled packs, in order.
     *
     * @throws RegistryConfigurationException if any pack is misconfigured
     */
    public static PackRegistry build(List<? extends Pack> enabledPacks) {
        Map<String, Action> index = new LinkedHashMap<>();
        List<PackDescriptor> descriptors = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        Map<String, String> namespaces = new LinkedHashMap<>();

        List<Pack> all = new ArrayList<>();
        MetaPack meta = new MetaPack();
        all.add(meta);
        all.addAll(enabledPacks);

        for (Pack pack : all) {
            String namespace = pack.namespace();
            if (namespace == null || namespace.isBlank() || namespace.contains(".")) {
                problems.add("pack namespace must be a non-blank single segment: '" + namespace + "'");
                continue;
            }
            if (namespaces.putIfAbsent(namespace, namespace) != null) {
                problems.add("duplicate pack namespace '" + namespace + "'");
                continue;
            }
            for (Action action : pack.actions()) {
                problems.addAll(check(namespace, action));
                String name = action.definition() == null ? null : action.definition().name();
                if (name != null && index.putIfAbsent(name, action) != null) {
                    problems.add("duplicate action name '" + name + "'");
                }
            }
            descriptors.add(pack.describe());
        }

        if (!problems.isEmpty()) {
            throw new RegistryConfigurationException(problems);
        }
        PackRegistry registry = new PackRegistry(index, descriptors);
        meta.bind(registry);
        log.info("Pack registry built: {} packs, {} actions", descriptors.size(), index.size());
        return registry;
    }

    private static List<String> check(String namespace, Action action) {
        List<String> problems = new ArrayList<>();
        ActionDefinition def = action.definition();
        if (def == null || def.name() == null || def.name().isBlank()) {
            problems.add("action in pack '" + namespace + "' has no name");
            return problems;
        }
        String name = def.name();
        if (!name.startsWith(namespace + ".") || name.length() == namespace.length() + 1) {
            problems.add("action '" + name + "' is outside namespace '" + namespace + "'");
        }
        if (action.handler() == null) {
            problems.add("action '" + name + "' has no handler");
        }
        if (def.requiredScope() == null || def.requiredScope().isBlank()) {
            problems.add("action '" + name + "' has no required scope");
        }
        if (def.inputSchema() == null) {
            problems.add("action '" + name + "' has no input schema");
        }
        if (def.outputSchema() == null) {
            problems.add("action '" + name + "' has no output schema");
        }
        if (def.supportsDryRun() && !def.sideEffecting()) {
            problems.add("action '" + name + "' supports dry run but is not side-effecting");
        }
        return problems;
    }

    public Optional<Action> lookup(String name) {
        return Optional.ofNullable(name == null ? null : actions.get(name));
    }

    /** Every action definition, in registration order. */
    public List<ActionDefinition> definitions() {
        return actions.values().stream().map(Action::definition).toList();
    }

    public List<PackDescriptor> packs() {
        return packs;
    }

    public int size() {
        return actions.size();
    }
}
