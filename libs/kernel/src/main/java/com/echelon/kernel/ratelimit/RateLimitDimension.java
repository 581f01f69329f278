package com.echelon.kernel.ratelimit;

/**
 * The subject a rate-limit bucket counts against.
 */
public enum RateLimitDimension {

    API_KEY("api_key"),
    TENANT("tenant"),
    SOURCE_IP("source_ip");

    private final String value;

    RateLimitDimension(String value) {
        this.value = value;
    }

    /** The canonical string representation, used in store keys and error details. */
    public String value() {
        return value;
    }
}
