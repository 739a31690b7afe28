package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

/** Asset registry read side. */
public interface AssetRegistry {

    /**
     * Returns the asset record, or null when the asset is unknown to the tenant. The record may carry
     * {@code storage_locations} (a list of location references).
     */
    Map<String, Object> getAsset(String assetRef, TenantContext tenant) throws PortException;
}
