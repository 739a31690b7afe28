package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

public interface QualityRulesResolver {

    /**
     * @throws PortException {@code INVALID} for malformed rules
     */
    Map<String, Object> resolve(String rulesRef, TenantContext tenant) throws PortException;
}
