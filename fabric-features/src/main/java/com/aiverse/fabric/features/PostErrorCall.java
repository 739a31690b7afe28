package com.aiverse.fabric.features;

/**
 * Runs after a unit returned an error code or threw.
 * Corresponds to phase {@link com.aiverse.fabric.annotations.FeaturePhase#POST_ERROR}.
 */
public interface PostErrorCall {

    /**
     * @param context    unit context with outcome and error code set
     * @param unitResult map form of the unit output; null when the unit threw
     */
    void afterError(UnitExecutionContext context, Object unitResult);
}
