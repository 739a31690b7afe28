package com.aiverse.fabric.features;

/**
 * Single post hook for features that do not care about the outcome. Used as a fallback for any post phase
 * when the feature implements none of {@link PostSuccessCall}, {@link PostErrorCall} or {@link FinallyCall}.
 */
public interface PostUnitCall {

    void after(UnitExecutionContext context, Object unitResult);
}
