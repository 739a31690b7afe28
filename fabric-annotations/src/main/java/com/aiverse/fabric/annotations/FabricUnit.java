package com.aiverse.fabric.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a Data Fabric execution unit. The unit registry reads the id and capability type
 * from this annotation; the remaining attributes describe the unit for capability discovery.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface FabricUnit {

    /** Unit id (e.g. "DataAssetRegistrar"). Must match the name used in intent decompositions. */
    String id();

    /** Capability type (e.g. "data-registration"). */
    String capabilityType();

    /** Optional description. */
    String description() default "";

    /** Compute class hint (cpu-small, cpu-medium, cpu-large). */
    String computeClass() default "cpu-small";

    /** Memory requirement hint (low, medium, high). */
    String memoryRequirements() default "low";

    /** I/O pattern (e.g. "read-external-write-staging"). */
    String ioPattern() default "";

    /** Free-form tags. */
    String[] tags() default { };
}
