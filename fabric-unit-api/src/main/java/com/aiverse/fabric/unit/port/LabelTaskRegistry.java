package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

/** Labeling tasks. */
public interface LabelTaskRegistry {

    /**
     * @return task id
     * @throws PortException {@code WRITE_FAILURE}
     */
    String createTask(String datasetRef, String schemaRef, List<String> sampleIds,
                      Map<String, Double> qualityRequirements, TenantContext tenant) throws PortException;

    /** Task record with {@code sample_ids} and {@code schema_ref}, or null when unknown. */
    Map<String, Object> getTask(String taskRef, TenantContext tenant) throws PortException;
}
