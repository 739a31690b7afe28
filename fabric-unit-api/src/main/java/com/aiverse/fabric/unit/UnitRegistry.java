package com.aiverse.fabric.unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tenant-scoped registry of execution units by tenant id and unit id. The invoker resolves the unit named
 * in an intent decomposition here; a tenant never sees another tenant's registrations.
 */
public final class UnitRegistry {

    private static final UnitRegistry INSTANCE = new UnitRegistry();

    /** tenantId → (unitId → UnitEntry) */
    private final Map<String, Map<String, UnitEntry>> unitsByTenant = new ConcurrentHashMap<>();

    public static UnitRegistry getInstance() {
        return INSTANCE;
    }

    private UnitRegistry() {
    }

    /** Registers a unit under its own id with version 1.0 and no metadata. */
    public void register(String tenantId, ExecutionUnit unit) {
        register(tenantId, unit, "1.0", null);
    }

    /**
     * Registers a unit for the given tenant.
     *
     * @param tenantId           tenant id ({@code organization_id/workspace_id}); blank means {@code default}
     * @param unit               implementation
     * @param version            unit version; null = unknown
     * @param capabilityMetadata optional metadata; null = empty
     * @throws IllegalArgumentException if the unit id is blank or already registered for this tenant
     */
    public void register(String tenantId, ExecutionUnit unit, String version, Map<String, Object> capabilityMetadata) {
        Objects.requireNonNull(unit, "unit");
        String tid = normalize(tenantId);
        String uid = Objects.requireNonNull(unit.id(), "id").trim();
        if (uid.isEmpty()) {
            throw new IllegalArgumentException("Unit id must be non-blank");
        }
        Map<String, UnitEntry> byId = unitsByTenant.computeIfAbsent(tid, k -> new ConcurrentHashMap<>());
        UnitEntry entry = new UnitEntry(uid, unit.capabilityType(), version, capabilityMetadata, unit);
        if (byId.putIfAbsent(uid, entry) != null) {
            throw new IllegalArgumentException("Unit already registered for tenant " + tid + ": " + uid);
        }
    }

    private static String normalize(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) return "default";
        return tenantId.trim();
    }

    /** Returns the entry for the tenant and unit id, or null if not registered. */
    public UnitEntry get(String tenantId, String unitId) {
        if (unitId == null || unitId.isBlank()) return null;
        Map<String, UnitEntry> byId = unitsByTenant.get(normalize(tenantId));
        return byId != null ? byId.get(unitId.trim()) : null;
    }

    public ExecutionUnit getExecutable(String tenantId, String unitId) {
        UnitEntry e = get(tenantId, unitId);
        return e != null ? e.getUnit() : null;
    }

    /** Units of the tenant providing the given capability type. */
    public List<UnitEntry> findByCapability(String tenantId, String capabilityType) {
        Map<String, UnitEntry> byId = unitsByTenant.get(normalize(tenantId));
        if (byId == null || capabilityType == null) return List.of();
        List<UnitEntry> out = new ArrayList<>();
        for (UnitEntry e : byId.values()) {
            if (capabilityType.equals(e.getCapabilityType())) out.add(e);
        }
        return out;
    }

    /** Sorted unit ids registered for the tenant. */
    public List<String> listUnitIds(String tenantId) {
        Map<String, UnitEntry> byId = unitsByTenant.get(normalize(tenantId));
        if (byId == null) return List.of();
        List<String> ids = new ArrayList<>(byId.keySet());
        Collections.sort(ids);
        return ids;
    }

    /** Removes one registration. Returns false when it was not registered. */
    public boolean unregister(String tenantId, String unitId) {
        Map<String, UnitEntry> byId = unitsByTenant.get(normalize(tenantId));
        if (byId == null || unitId == null) return false;
        boolean removed = byId.remove(unitId.trim()) != null;
        if (byId.isEmpty()) {
            unitsByTenant.remove(normalize(tenantId), byId);
        }
        return removed;
    }

    /** tenant id → (unit id → entry). For iteration and shutdown. */
    public Map<String, Map<String, UnitEntry>> getAllByTenant() {
        return Collections.unmodifiableMap(unitsByTenant);
    }

    /** Removes all registrations. */
    public void clear() {
        unitsByTenant.clear();
    }

    /** Registered unit: id, capability type, version, capability metadata and the instance. */
    public static final class UnitEntry {
        private final String id;
        private final String capabilityType;
        private final String version;
        private final Map<String, Object> capabilityMetadata;
        private final ExecutionUnit unit;

        UnitEntry(String id, String capabilityType, String version,
                  Map<String, Object> capabilityMetadata, ExecutionUnit unit) {
            this.id = id;
            this.capabilityType = capabilityType;
            this.version = version;
            this.capabilityMetadata = capabilityMetadata != null ? Map.copyOf(capabilityMetadata) : Map.of();
            this.unit = unit;
        }

        public String getId() {
            return id;
        }

        public String getCapabilityType() {
            return capabilityType;
        }

        /** Unit version; null = unknown. */
        public String getVersion() {
            return version;
        }

        public Map<String, Object> getCapabilityMetadata() {
            return capabilityMetadata;
        }

        public ExecutionUnit getUnit() {
            return unit;
        }
    }
}
