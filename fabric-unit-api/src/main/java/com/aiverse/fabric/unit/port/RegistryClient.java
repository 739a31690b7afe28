package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.AssetType;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

/** Asset registry write side. */
public interface RegistryClient {

    /**
     * Creates a registry card for an asset.
     *
     * @param metadata {@code schema, location, classification, format, owner}
     * @return card reference
     * @throws PortException {@code UNAVAILABLE}, {@code CONFLICT} (name and version taken) or {@code ACCESS_DENIED}
     */
    String createCard(TenantContext tenant, AssetType assetType, String name, String version,
                      Map<String, Object> metadata) throws PortException;
}
