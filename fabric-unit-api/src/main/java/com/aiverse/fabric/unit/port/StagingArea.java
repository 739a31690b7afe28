package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.DataFormat;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

/**
 * Intermediate storage between units. Every staging reference is scoped to the tenant passed in.
 * Reads fail with {@code READ_FAILURE}; writes fail with {@code WRITE_FAILURE} or {@code QUOTA_EXCEEDED}.
 */
public interface StagingArea {

    StagedData read(String stagingRef, TenantContext tenant) throws PortException;

    /**
     * Writes data under the reference, replacing what was there.
     *
     * @param format output format, or null to keep the format of the data
     * @return bytes written
     */
    long write(String stagingRef, byte[] data, DataFormat format, TenantContext tenant) throws PortException;

    record StagedData(byte[] data, Map<String, Object> metadata) {
        public StagedData {
            metadata = Copies.map(metadata);
        }
    }
}
