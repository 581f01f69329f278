package com.echelon.security;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Well-known scope names and the effective-scope computation.
 * <p>
 * WHY a utility class: the intersection {@code credential.scopes ∩ allowedScopesFor(state)}
 * must be computed identically by the resolver on every request. It is never cached on the
 * credential, so verifying a tenant widens every existing key on its next use.
 */
public final class Scopes {

    /** Read-only access to tenant resources. */
    public static final String READ = "manage.read";

    /** Capability discovery ({@code meta.*} actions). */
    public static final String DISCOVER = "manage.discover";

    /** API key and team management. */
    public static final String IAM = "manage.iam";

    /** Webhook management. */
    public static final String WEBHOOKS = "manage.webhooks";

    /** Tenant settings management. */
    public static final String SETTINGS = "manage.settings";

    /** Every scope a credential can declare. */
    public static final List<String> ALL = List.of(READ, DISCOVER, IAM, WEBHOOKS, SETTINGS);

    /** The fixed minimal set available to unverified tenants: read + discovery. */
    public static final Set<String> UNVERIFIED_SCOPES = Set.of(READ, DISCOVER);

    private Scopes() {
        // utility class
    }

    /**
     * Computes the effective scope set of a credential for a tenant in the given state.
     *
     * @param declared the scopes stored on the credential
     * @param state    the tenant's current verification state
     * @return an immutable, iteration-ordered copy of the permitted scopes
     */
    public static Set<String> effective(Set<String> declared, VerificationState state) {
        Set<String> result = new LinkedHashSet<>();
        for (String scope : declared) {
            if (state.permits(scope)) {
                result.add(scope);
            }
        }
        return Set.copyOf(result);
    }

    /**
     * Checks whether the given scope set grants the required scope. Matching is exact.
     */
    public static boolean grants(Set<String> scopes, String required) {
        return scopes.contains(required);
    }
}
