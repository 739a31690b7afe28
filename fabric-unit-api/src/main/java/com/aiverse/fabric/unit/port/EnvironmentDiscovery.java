package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.List;

public interface EnvironmentDiscovery {

    /** Execution environment ids available to the tenant. */
    List<String> getEnvironments(TenantContext tenant) throws PortException;
}
