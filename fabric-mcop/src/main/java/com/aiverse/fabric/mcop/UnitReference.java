package com.aiverse.fabric.mcop;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reference to an execution unit within an intent decomposition.
 *
 * @param inputMapping intent input key to unit parameter path ({@code a.b} means {@code {a: {b: value}}})
 */
public record UnitReference(String name, String capabilityType, Map<String, String> inputMapping) {

    public UnitReference {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(capabilityType, "capabilityType");
        inputMapping = inputMapping != null ? Map.copyOf(inputMapping) : Map.of();
    }

    /** Decomposition entry sent to the intent engine: name, capability_type, input_mapping, domain. */
    public Map<String, Object> toSpec(String domain) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("name", name);
        spec.put("capability_type", capabilityType);
        spec.put("input_mapping", new TreeMap<>(inputMapping));
        spec.put("domain", domain);
        return spec;
    }

    /**
     * Builds this unit's input map from intent inputs. Intent inputs named like a top-level unit parameter
     * (e.g. {@code extraction_input}) are copied first; mapped keys are then written at their paths,
     * overriding copied values.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> resolveInputs(Map<String, Object> intentInputs) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (intentInputs == null) return out;
        for (String path : inputMapping.values()) {
            String root = path.split("\\.", 2)[0];
            Object v = intentInputs.get(root);
            if (v != null && !out.containsKey(root)) {
                out.put(root, v instanceof Map ? deepCopy((Map<String, Object>) v) : v);
            }
        }
        for (Map.Entry<String, String> m : inputMapping.entrySet()) {
            if (intentInputs.containsKey(m.getKey())) {
                put(out, m.getValue().split("\\."), intentInputs.get(m.getKey()));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static void put(Map<String, Object> target, String[] path, Object value) {
        Map<String, Object> cur = target;
        for (int i = 0; i < path.length - 1; i++) {
            Object next = cur.get(path[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                cur.put(path[i], next);
            }
            cur = (Map<String, Object>) next;
        }
        cur.put(path[path.length - 1], value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : source.entrySet()) {
            Object v = e.getValue();
            copy.put(e.getKey(), v instanceof Map ? deepCopy((Map<String, Object>) v) : v);
        }
        return copy;
    }
}
