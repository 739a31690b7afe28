package com.aiverse.fabric.ratelimit;

/**
 * Request classes with separate per-tenant limits.
 */
public enum RateClass {
    READ("read"),
    WRITE("write"),
    COMPUTE("compute");

    private final String value;

    RateClass(String value) {
        this.value = value;
    }

    /** Lowercase name used in Redis keys, tenant config and error details. */
    public String value() {
        return value;
    }
}
