package com.aiverse.fabric.signals;

/**
 * When a signal fires for a completed unit.
 */
public enum EmissionCondition {
    ALWAYS,
    ON_SUCCESS,
    ON_FAILURE;

    public boolean matches(boolean unitSucceeded) {
        return switch (this) {
            case ALWAYS -> true;
            case ON_SUCCESS -> unitSucceeded;
            case ON_FAILURE -> !unitSucceeded;
        };
    }

    /** Parses {@code always|on_success|on_failure}; missing or unknown means always. */
    public static EmissionCondition fromValue(String value) {
        if (value == null || value.isBlank()) return ALWAYS;
        return switch (value.trim().toLowerCase()) {
            case "on_success" -> ON_SUCCESS;
            case "on_failure" -> ON_FAILURE;
            default -> ALWAYS;
        };
    }
}
