package com.aiverse.fabric.features;

import java.util.Map;
import java.util.Objects;

/**
 * Context passed to feature hooks when an execution unit is about to run (pre) or has just run (post).
 * Carries the unit identity, the owning intent execution and the tenant with its config. Post hooks receive
 * a copy produced by {@link #withOutcome(boolean, String, long)}.
 */
public final class UnitExecutionContext {

    private final String executionId;
    private final String intentType;
    private final String unitId;
    private final String capabilityType;
    private final String tenantId;
    private final Map<String, Object> tenantConfigMap;
    private final Map<String, Object> attributes;
    /** True = success path, false = error path, null = pre. */
    private final Boolean executionSucceeded;
    private final String errorCode;
    private final long durationMs;

    public UnitExecutionContext(String executionId, String intentType, String unitId, String capabilityType,
                                String tenantId, Map<String, Object> tenantConfigMap, Map<String, Object> attributes) {
        this(executionId, intentType, unitId, capabilityType, tenantId, tenantConfigMap, attributes, null, null, 0L);
    }

    private UnitExecutionContext(String executionId, String intentType, String unitId, String capabilityType,
                                 String tenantId, Map<String, Object> tenantConfigMap, Map<String, Object> attributes,
                                 Boolean executionSucceeded, String errorCode, long durationMs) {
        this.executionId = executionId != null ? executionId : "";
        this.intentType = intentType != null ? intentType : "";
        this.unitId = Objects.requireNonNull(unitId, "unitId");
        this.capabilityType = capabilityType != null ? capabilityType : "";
        this.tenantId = tenantId != null ? tenantId : "";
        this.tenantConfigMap = tenantConfigMap != null ? Map.copyOf(tenantConfigMap) : Map.of();
        this.attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        this.executionSucceeded = executionSucceeded;
        this.errorCode = errorCode;
        this.durationMs = durationMs;
    }

    public UnitExecutionContext(String unitId, String capabilityType, String tenantId) {
        this(null, null, unitId, capabilityType, tenantId, null, null);
    }

    /** Returns a new context with the invocation outcome, for the post phases. */
    public UnitExecutionContext withOutcome(boolean succeeded, String errorCode, long durationMs) {
        return new UnitExecutionContext(executionId, intentType, unitId, capabilityType, tenantId, tenantConfigMap,
                attributes, succeeded, errorCode, durationMs);
    }

    /** Intent execution id this invocation belongs to. Empty when invoked outside an intent. */
    public String getExecutionId() {
        return executionId;
    }

    public String getIntentType() {
        return intentType;
    }

    public String getUnitId() {
        return unitId;
    }

    /** Capability type of the unit (e.g. data-extraction). */
    public String getCapabilityType() {
        return capabilityType;
    }

    /** Tenant id ({@code organization_id/workspace_id}). */
    public String getTenantId() {
        return tenantId;
    }

    /** Tenant-specific config. Unmodifiable. */
    public Map<String, Object> getTenantConfigMap() {
        return tenantConfigMap;
    }

    /** Extra context such as the unit input or trace id. Unmodifiable. */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Boolean getExecutionSucceeded() {
        return executionSucceeded;
    }

    public boolean isExecutionSucceeded() {
        return Boolean.TRUE.equals(executionSucceeded);
    }

    /** Error code of the unit output, or EXECUTION_FAILED when the unit threw; null on success or in pre. */
    public String getErrorCode() {
        return errorCode;
    }

    /** Wall time of the unit call; 0 in pre. */
    public long getDurationMs() {
        return durationMs;
    }

    @SuppressWarnings("unchecked")
    public <T> T getAttribute(String key, Class<T> type) {
        Object v = attributes.get(key);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }
}
