package com.aiverse.fabric.features;

/**
 * Runs after a unit returned an output without an error code.
 * Corresponds to phase {@link com.aiverse.fabric.annotations.FeaturePhase#POST_SUCCESS}.
 */
public interface PostSuccessCall {

    /**
     * @param context    unit context with outcome set
     * @param unitResult map form of the unit output
     */
    void afterSuccess(UnitExecutionContext context, Object unitResult);
}
