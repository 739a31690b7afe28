package com.aiverse.fabric.catalog;

import java.util.Locale;

/**
 * How far a tenant's catalog scope reaches. STRICT scopes to the workspace; SHARED and HYBRID scope to the organization.
 */
public enum IsolationMode {
    STRICT,
    SHARED,
    HYBRID;

    public static IsolationMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STRICT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
