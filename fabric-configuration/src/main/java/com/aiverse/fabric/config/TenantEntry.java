package com.aiverse.fabric.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tenant entry in the tenant config file (FABRIC_TENANT_CONFIG_FILE): a JSON array of
 * {@code {"id":"org/ws","name":"...","config":{"rateLimits":{"write":20}}}}.
 * Used at bootstrap to populate {@link TenantConfigRegistry} and extend the tenant list.
 */
public final class TenantEntry {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final String name;
    private final Map<String, Object> config;

    public TenantEntry(String id, String name, Map<String, Object> config) {
        this.id = id != null ? id.trim() : "";
        this.name = name != null ? name.trim() : "";
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Tenant config map; empty when the entry has no {@code config} object. */
    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Parses a JSON array of tenant entries. Entries without an id are skipped; the first entry wins for a
     * repeated id.
     *
     * @throws IllegalArgumentException when the document is not a JSON array
     */
    public static List<TenantEntry> parse(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tenant config is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Tenant config must be a JSON array of tenant entries");
        }
        Set<String> seen = new LinkedHashSet<>();
        List<TenantEntry> entries = new ArrayList<>();
        for (JsonNode node : root) {
            if (node == null || !node.hasNonNull("id")) continue;
            String id = node.get("id").asText("").trim();
            if (id.isEmpty() || !seen.add(id)) continue;
            String name = node.hasNonNull("name") ? node.get("name").asText() : "";
            Map<String, Object> config = null;
            JsonNode cfg = node.get("config");
            if (cfg != null && cfg.isObject()) {
                config = MAPPER.convertValue(cfg, MAPPER.getTypeFactory()
                        .constructMapType(LinkedHashMap.class, String.class, Object.class));
            }
            entries.add(new TenantEntry(id, name, config));
        }
        return Collections.unmodifiableList(entries);
    }
}
