package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

/** Reads persisted datasets. Fails with {@code READ_FAILURE}, or {@code INVALID} for a corrupt dataset. */
public interface DatasetReader {

    byte[] readDataset(String datasetRef, TenantContext tenant) throws PortException;

    /** Current content plus the change counts relative to the parent commit. */
    DatasetState readDatasetState(String datasetRef, TenantContext tenant) throws PortException;

    /** {@code changeset} holds counts such as {@code added}, {@code modified}, {@code deleted}. */
    record DatasetState(byte[] content, Map<String, Integer> changeset) {
        public DatasetState {
            changeset = Copies.map(changeset);
        }
    }
}
