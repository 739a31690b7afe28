package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

public interface DatasetRegistry {

    /** Dataset record, or null when unknown. */
    Map<String, Object> getDataset(String datasetRef, TenantContext tenant) throws PortException;
}
