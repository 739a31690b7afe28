package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

public interface LineageStore {

    /**
     * @return edge id
     * @throws PortException {@code WRITE_FAILURE}
     */
    String createEdge(String sourceRef, String targetRef, String relationshipType, String executionRef,
                      TenantContext tenant) throws PortException;
}
