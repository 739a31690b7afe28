package com.aiverse.fabric.unit.port;

/** Verdict of a schema check; {@code error} is null when valid. */
public record SchemaCheck(boolean valid, String error) {

    public static SchemaCheck ok() {
        return new SchemaCheck(true, null);
    }

    public static SchemaCheck invalid(String error) {
        return new SchemaCheck(false, error);
    }
}
