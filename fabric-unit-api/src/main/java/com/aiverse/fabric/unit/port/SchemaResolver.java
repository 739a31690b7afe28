package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

public interface SchemaResolver {

    /**
     * @throws PortException {@code UNAVAILABLE} or {@code NOT_FOUND}
     */
    Map<String, Object> resolve(String schemaRef, TenantContext tenant) throws PortException;
}
