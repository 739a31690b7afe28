package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

public interface CredentialResolver {

    /**
     * Resolves a credential reference to its secret material.
     *
     * @throws PortException {@code UNAVAILABLE} or {@code NOT_FOUND} when the reference cannot be resolved
     */
    Map<String, Object> resolve(String credentialRef, TenantContext tenant) throws PortException;
}
