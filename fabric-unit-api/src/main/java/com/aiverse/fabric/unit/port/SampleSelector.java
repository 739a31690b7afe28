package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

public interface SampleSelector {

    /** Ids of the records matching the criteria; empty when none match. */
    List<String> selectSamples(String datasetRef, Map<String, Object> criteria, TenantContext tenant)
            throws PortException;
}
