package com.echelon.kernel.registry;

/**
 * Static description of an action, as exposed by {@code meta.actions}.
 *
 * @param name           namespace-qualified name, e.g. {@code iam.keys.create}
 * @param requiredScope  scope the caller's effective scopes must contain
 * @param description    human-readable summary
 * @param inputSchema    schema the payload is validated against
 * @param outputSchema   schema of the returned data
 * @param sideEffecting  true if the action mutates state (idempotency keys apply)
 * @param supportsDryRun true if the handler can describe its impact without executing
 */
public record ActionDefinition(
        String name,
        String requiredScope,
        String description,
        FieldSchema inputSchema,
        FieldSchema outputSchema,
        boolean sideEffecting,
        boolean supportsDryRun) {

    /** A read-only action. */
    public static ActionDefinition read(String name, String requiredScope, String description,
                                        FieldSchema inputSchema, FieldSchema outputSchema) {
        return new ActionDefinition(name, requiredScope, description, inputSchema, outputSchema, false, false);
    }

    /** A side-effecting action that supports dry runs. */
    public static ActionDefinition mutation(String name, String requiredScope, String description,
                                            FieldSchema inputSchema, FieldSchema outputSchema) {
        return new ActionDefinition(name, requiredScope, description, inputSchema, outputSchema, true, true);
    }

    /** The namespace: everything before the first dot. */
    public String namespace() {
        int dot = name == null ? -1 : name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
