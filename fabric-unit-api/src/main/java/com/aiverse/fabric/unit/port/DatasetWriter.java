package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.WriteMode;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

public interface DatasetWriter {

    /**
     * Persists data into a dataset.
     *
     * @param partitionSpec partition columns and values; null for unpartitioned writes
     * @throws PortException {@code WRITE_FAILURE}, {@code SCHEMA_MISMATCH} or {@code QUOTA_EXCEEDED}
     */
    DatasetWrite writeDataset(String datasetRef, byte[] data, WriteMode writeMode,
                              Map<String, Object> partitionSpec, TenantContext tenant) throws PortException;

    record DatasetWrite(long bytesWritten, long rowsWritten, String location) {
    }
}
