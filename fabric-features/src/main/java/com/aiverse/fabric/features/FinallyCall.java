package com.aiverse.fabric.features;

/**
 * Runs after every unit invocation, after the success or error hooks.
 * Corresponds to phase {@link com.aiverse.fabric.annotations.FeaturePhase#FINALLY}.
 * Keep it to logging, metrics and cleanup.
 */
public interface FinallyCall {

    void afterFinally(UnitExecutionContext context, Object unitResult);
}
