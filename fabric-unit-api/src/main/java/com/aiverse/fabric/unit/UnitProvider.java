package com.aiverse.fabric.unit;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Creates one execution unit from bound ports. The worker registers a provider's unit for every tenant,
 * but only when every port in {@link #requiredPorts()} is bound.
 */
public interface UnitProvider {

    String getUnitId();

    String getCapabilityType();

    /** Port interfaces the unit cannot run without. */
    List<Class<?>> requiredPorts();

    /** Creates the unit; called only when {@link #isEnabled(PortBindings)} is true. */
    ExecutionUnit createUnit(PortBindings ports);

    default String getVersion() {
        return "1.0";
    }

    /** Capability metadata for audit (compute class, tags). Empty by default. */
    default Map<String, Object> getCapabilityMetadata() {
        return Collections.emptyMap();
    }

    default boolean isEnabled(PortBindings ports) {
        return ports.hasAll(requiredPorts());
    }
}
