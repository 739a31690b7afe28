package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

public interface FeatureDefinitionResolver {

    /** Returns the definition, or null when it does not exist. May also fail with {@code NOT_FOUND}. */
    Map<String, Object> resolve(String featureDefinitionRef, TenantContext tenant) throws PortException;
}
