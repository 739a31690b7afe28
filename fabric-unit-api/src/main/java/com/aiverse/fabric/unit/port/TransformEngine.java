package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.unit.PortException;

import java.util.Map;

public interface TransformEngine {

    /**
     * @throws PortException {@code COMPUTATION} or {@code RESOURCE_EXHAUSTED}
     */
    TransformOutput applyTransform(byte[] input, Map<String, Object> definition, Map<String, Object> parameters)
            throws PortException;

    record TransformOutput(byte[] data, long rowsIn, long rowsOut) {
    }
}
