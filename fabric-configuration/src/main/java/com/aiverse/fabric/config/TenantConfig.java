package com.aiverse.fabric.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tenant-specific configuration (rate-limit overrides, metrics options, adapter parameters).
 * Passed to execution units and available to features through the unit execution context.
 */
public interface TenantConfig {

    /** Empty config (no tenant-specific parameters). */
    TenantConfig EMPTY = new TenantConfig() {
        @Override
        public String getTenantId() {
            return "";
        }
        @Override
        public Object get(String key) {
            return null;
        }
        @Override
        public Map<String, Object> getConfigMap() {
            return Collections.emptyMap();
        }
    };

    /** Tenant id this config applies to. */
    String getTenantId();

    /**
     * Gets a config value by key (e.g. "rateLimits", "metrics").
     *
     * @param key config key
     * @return value or null if absent
     */
    Object get(String key);

    /** Returns the full config map (read-only). */
    Map<String, Object> getConfigMap();

    /**
     * Reads a nested integer, e.g. {@code getNestedInt("rateLimits", "read", 1000)}.
     * Non-numeric or missing values return the default.
     */
    default int getNestedInt(String section, String key, int defaultValue) {
        Object s = get(section);
        if (!(s instanceof Map)) return defaultValue;
        Object v = ((Map<?, ?>) s).get(key);
        if (v instanceof Number) return ((Number) v).intValue();
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Creates a tenant config from a map.
     *
     * @param tenantId tenant id
     * @param config   config map (may be null; copied and made unmodifiable)
     */
    static TenantConfig of(String tenantId, Map<String, Object> config) {
        if ((tenantId == null || tenantId.isBlank()) && (config == null || config.isEmpty())) {
            return EMPTY;
        }
        String tid = tenantId != null ? tenantId.trim() : "";
        Map<String, Object> copy = config != null && !config.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Collections.emptyMap();
        return new TenantConfig() {
            @Override
            public String getTenantId() {
                return tid;
            }
            @Override
            public Object get(String key) {
                return copy.get(Objects.requireNonNull(key, "key"));
            }
            @Override
            public Map<String, Object> getConfigMap() {
                return copy;
            }
        };
    }
}
