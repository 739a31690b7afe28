package com.aiverse.fabric.worker.engine;

import com.aiverse.fabric.contracts.Copies;

import java.util.Map;

/**
 * Outcome of one unit invocation as seen by the engine.
 *
 * @param output map form of the unit output ({@code result, error_code, error_message} and the flags)
 */
public record UnitInvocation(
        String unitId,
        String capabilityType,
        boolean succeeded,
        String errorCode,
        String errorMessage,
        Map<String, Object> output,
        long durationMs) {

    public UnitInvocation {
        output = Copies.map(output);
    }
}
