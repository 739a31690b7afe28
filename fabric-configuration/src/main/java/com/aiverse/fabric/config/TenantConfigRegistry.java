package com.aiverse.fabric.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of tenant-specific configuration. Populated at bootstrap; read by the rate limiter,
 * the unit invoker and features.
 */
public final class TenantConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantConfigRegistry.class);
    private static final TenantConfigRegistry INSTANCE = new TenantConfigRegistry();

    private final Map<String, TenantConfig> byTenant = new ConcurrentHashMap<>();

    public static TenantConfigRegistry getInstance() {
        return INSTANCE;
    }

    private TenantConfigRegistry() {
    }

    /**
     * Registers config for a tenant.
     *
     * @param tenantId tenant id
     * @param config   tenant config (null = store empty config)
     */
    public void put(String tenantId, TenantConfig config) {
        if (tenantId == null || tenantId.isBlank()) return;
        String tid = tenantId.trim();
        byTenant.put(tid, config != null ? config : TenantConfig.EMPTY);
        log.debug("Registered tenant config for tenant={}", tid);
    }

    /** Registers config for a tenant from a map (e.g. parsed from JSON). */
    public void put(String tenantId, Map<String, Object> configMap) {
        put(tenantId, TenantConfig.of(tenantId, configMap));
    }

    /**
     * Returns the tenant config, or {@link TenantConfig#EMPTY} if none is registered.
     */
    public TenantConfig get(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) return TenantConfig.EMPTY;
        return Objects.requireNonNullElse(byTenant.get(tenantId.trim()), TenantConfig.EMPTY);
    }

    /** Removes the config for a tenant; returns true when one was registered. */
    public boolean remove(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) return false;
        return byTenant.remove(tenantId.trim()) != null;
    }

    /** Clears all registrations (mainly for tests). */
    public void clear() {
        byTenant.clear();
    }
}
