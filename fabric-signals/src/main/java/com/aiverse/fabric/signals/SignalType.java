package com.aiverse.fabric.signals;

/**
 * Feedback signal categories.
 */
public enum SignalType {
    METRIC("metric"),
    OUTCOME("outcome"),
    ADVISOR("advisor");

    private final String value;

    SignalType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Parses the JSON value (metric, outcome, advisor); null for anything else. */
    public static SignalType fromValue(String value) {
        if (value == null) return null;
        for (SignalType t : values()) {
            if (t.value.equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
