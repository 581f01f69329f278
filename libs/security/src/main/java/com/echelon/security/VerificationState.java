package com.echelon.security;

/**
 * Verification lifecycle of a tenant.
 * <p>
 * WHY an enum with a single forward transition: {@code UNVERIFIED → VERIFIED} is terminal and
 * there is no regression path inside the kernel. The state is the only input, besides the
 * credential's declared scopes, to the effective scope computation in {@link Scopes}.
 */
public enum VerificationState {

    UNVERIFIED("unverified"),
    VERIFIED("verified");

    private final String value;

    VerificationState(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }

    /**
     * Checks whether a tenant in this state may exercise the given scope at all.
     * Unverified tenants are limited to {@link Scopes#UNVERIFIED_SCOPES}.
     */
    public boolean permits(String scope) {
        return this == VERIFIED || Scopes.UNVERIFIED_SCOPES.contains(scope);
    }
}
