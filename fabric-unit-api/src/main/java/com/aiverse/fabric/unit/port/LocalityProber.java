package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.unit.PortException;

import java.util.List;

public interface LocalityProber {

    /**
     * Probes how close each execution environment is to the storage locations.
     *
     * @throws PortException {@code UNREACHABLE} with the environment id as subject, or {@code TIMEOUT}
     */
    List<ProbedLocality> probeLocality(List<String> storageLocations, List<String> executionEnvironments)
            throws PortException;

    /** {@code localityType} is the wire value: local, cached, remote or unavailable. */
    record ProbedLocality(String environmentId, String localityType, double transferCost, double confidence) {
    }
}
