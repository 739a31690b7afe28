package com.aiverse.fabric.mcop;

import com.aiverse.fabric.contracts.replication.LocalitySignal;

import java.util.List;
import java.util.UUID;

/**
 * MCOP scheduler port: receives capability profiles and data locality hints. Hints influence placement but do
 * not determine it.
 */
public interface CapabilityScheduler {

    boolean provideCapability(String executionUnitName, CapabilityProfile profile) throws McopException;

    boolean provideLocalitySignals(UUID intentRef, String assetRef, List<LocalitySignal> signals) throws McopException;
}
