package com.aiverse.fabric.mcop;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local asset registry used when no control plane is configured, and by tests.
 */
public final class InMemoryAssetRegistryClient implements AssetRegistryClient {

    private record Registration(UUID id, RegistryCard card, Map<String, Object> metadata) { }

    private final Map<UUID, Registration> registrations = new ConcurrentHashMap<>();

    @Override
    public UUID registerCapability(RegistryCard card, Map<String, Object> metadata) {
        UUID id = UUID.randomUUID();
        registrations.put(id, new Registration(id, card, metadata != null ? Map.copyOf(metadata) : Map.of()));
        return id;
    }

    @Override
    public boolean unregisterCapability(UUID cardId) {
        return cardId != null && registrations.remove(cardId) != null;
    }

    /** Sorted by name. */
    @Override
    public List<Map<String, Object>> getCapabilitiesByDomain(String domain) {
        List<Registration> matching = new ArrayList<>();
        for (Registration r : registrations.values()) {
            if (r.card().domain().equals(domain)) matching.add(r);
        }
        matching.sort(Comparator.comparing(r -> r.card().name()));
        List<Map<String, Object>> out = new ArrayList<>(matching.size());
        for (Registration r : matching) {
            RegistryCard c = r.card();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", r.id().toString());
            m.put("name", c.name());
            m.put("version", c.version());
            m.put("domain", c.domain());
            m.put("capability_type", c.capabilityType());
            m.put("tags", c.capabilityTags());
            m.put("description", c.description());
            m.put("input_contract", c.inputContract());
            m.put("output_contract", c.outputContract());
            m.put("consumer_intents", c.consumerIntents());
            m.put("metadata", r.metadata());
            out.add(m);
        }
        return out;
    }

    public int size() {
        return registrations.size();
    }
}
