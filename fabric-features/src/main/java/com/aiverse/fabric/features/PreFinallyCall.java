package com.aiverse.fabric.features;

/**
 * Contract for feature logic that runs before a unit and again after it (success, error, and finally).
 * Corresponds to phase {@link com.aiverse.fabric.annotations.FeaturePhase#PRE_FINALLY}.
 */
public interface PreFinallyCall extends PreUnitCall {

    /**
     * Called after the unit returned an output without an error code.
     *
     * @param context    unit context
     * @param unitResult map form of the unit output
     */
    void afterSuccess(UnitExecutionContext context, Object unitResult);

    /**
     * Called after the unit returned an error code or threw.
     *
     * @param context    unit context
     * @param unitResult map form of the unit output, null when the unit threw
     */
    void afterError(UnitExecutionContext context, Object unitResult);

    /**
     * Called after the unit completed. Always runs after afterSuccess or afterError.
     */
    void afterFinally(UnitExecutionContext context, Object unitResult);
}
