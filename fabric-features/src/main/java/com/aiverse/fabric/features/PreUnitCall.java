package com.aiverse.fabric.features;

/**
 * Contract for feature logic that runs before an execution unit is invoked.
 * Corresponds to phase {@link com.aiverse.fabric.annotations.FeaturePhase#PRE}.
 */
public interface PreUnitCall {

    /**
     * Called before the unit runs. An internal feature may throw to stop the invocation.
     *
     * @param context unit context (tenant, unit id, capability)
     */
    void before(UnitExecutionContext context);
}
