package com.aiverse.fabric.unit;

import com.aiverse.fabric.contracts.TenantContext;

import java.util.Map;

/**
 * Base contract for all execution units: execute with an input map and the caller's tenant, return a
 * {@link UnitOutput}. The invoker runs any unit through this interface without depending on concrete types.
 * <p>
 * <b>Threading and state:</b> units are stateless. One instance per tenant is shared by concurrent
 * executions, so implementations must not keep mutable state between calls. A unit never invokes
 * another unit; composition belongs to the intent engine.
 */
public interface ExecutionUnit {

    /** Unit id, e.g. {@code DataExtractor}. Matches registry cards and intent decompositions. */
    String id();

    /** Single capability this unit provides, e.g. {@code data-extraction}. */
    String capabilityType();

    /**
     * Executes the unit.
     *
     * @param inputs map of unit parameter names to values (unit-specific, snake_case)
     * @param tenant tenant the execution runs for; never null
     * @return output carrying either a result or an error code
     * @throws IllegalArgumentException when the inputs do not match the unit's input contract
     * @throws PortException            when a port fails in a way the unit does not map to an error code
     */
    UnitOutput<?> execute(Map<String, Object> inputs, TenantContext tenant) throws PortException;
}
