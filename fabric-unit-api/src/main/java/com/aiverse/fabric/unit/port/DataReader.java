package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

/** Bounded reads from an external source. */
public interface DataReader {

    /**
     * @throws PortException {@code READ_FAILURE} or {@code FORMAT}
     */
    SourceBatch readData(String connectionRef, String queryOrPath, long offset, long limit, TenantContext tenant)
            throws PortException;

    /** {@code watermark} is null when the source has no incremental marker. */
    record SourceBatch(byte[] data, long rowCount, String watermark) {
    }
}
