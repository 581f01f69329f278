package com.echelon.security;

import java.util.Optional;

/**
 * Tenant tiers.
 * <p>
 * WHY an enum: tenants fall into fixed tiers that scale their configured rate limits.
 * Tiers never affect ceilings, which are absolute.
 */
public enum TenantTier {

    FREE("free", 1),
    STANDARD("standard", 2),
    PREMIUM("premium", 5),
    ENTERPRISE("enterprise", 20);

    private final String value;
    private final int rateLimitMultiplier;

    TenantTier(String value, int rateLimitMultiplier) {
        this.value = value;
        this.rateLimitMultiplier = rateLimitMultiplier;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }

    /** Factor applied to the base rate limits configured for each window. */
    public int rateLimitMultiplier() {
        return rateLimitMultiplier;
    }

    /** Looks up a tier by its canonical value (case-insensitive). */
    public static Optional<TenantTier> fromString(String value) {
        for (TenantTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
