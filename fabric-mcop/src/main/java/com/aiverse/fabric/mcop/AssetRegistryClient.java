package com.aiverse.fabric.mcop;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Control-plane asset registry port.
 */
public interface AssetRegistryClient {

    /**
     * Registers a capability card.
     *
     * @param metadata extra registration data (failure modes, registration time)
     * @return id assigned to the card
     */
    UUID registerCapability(RegistryCard card, Map<String, Object> metadata) throws McopException;

    /** Returns false if no card has that id. */
    boolean unregisterCapability(UUID cardId) throws McopException;

    /** Registered capabilities of the domain, each as a map with at least {@code id} and {@code name}. */
    List<Map<String, Object>> getCapabilitiesByDomain(String domain) throws McopException;
}
