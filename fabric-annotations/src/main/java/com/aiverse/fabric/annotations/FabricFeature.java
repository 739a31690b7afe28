package com.aiverse.fabric.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a feature that runs around execution unit invocations.
 * Register it with the feature registry and implement the pre/post contracts matching {@link #phase()}.
 * {@link #applicableUnits()} supports exact unit ids, capability prefixes ("data-*") and "*" for all units.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface FabricFeature {

    /** Unique feature name. */
    String name();

    /** Feature contract version. */
    String contractVersion() default "1.0";

    /** When to invoke: PRE, POST_SUCCESS, POST_ERROR, FINALLY, or PRE_FINALLY. */
    FeaturePhase phase() default FeaturePhase.PRE_FINALLY;

    /** Unit ids or capability patterns this feature applies to. Empty = all. */
    String[] applicableUnits() default { };
}
