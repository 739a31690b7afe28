package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.ConsistencyMode;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

/** Raw storage locations, possibly in another region or cloud. */
public interface StorageClient {

    /**
     * @throws PortException {@code READ_FAILURE} or {@code NETWORK}
     */
    byte[] readLocation(String locationRef, TenantContext tenant) throws PortException;

    /**
     * @return confirmation token from the target
     * @throws PortException {@code WRITE_FAILURE} or {@code NETWORK}
     */
    String writeLocation(String locationRef, byte[] data, ConsistencyMode consistencyMode, TenantContext tenant)
            throws PortException;
}
