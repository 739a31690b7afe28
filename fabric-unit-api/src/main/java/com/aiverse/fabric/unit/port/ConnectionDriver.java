package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.unit.PortException;

import java.util.Map;

/** Opens a test connection to an external source. */
public interface ConnectionDriver {

    /**
     * @throws PortException {@code TIMEOUT}, {@code AUTHENTICATION} or {@code NETWORK}
     */
    ProbeOutcome testConnection(Map<String, Object> connectionConfig, Map<String, Object> credentials,
                                int timeoutSeconds) throws PortException;

    /** {@code error} is the driver's own failure description, null on success. */
    record ProbeOutcome(boolean success, long latencyMs, String error) {
    }
}
