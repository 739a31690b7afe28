package com.aiverse.fabric.signals;

import com.aiverse.fabric.contracts.FabricJson;
import com.aiverse.fabric.contracts.JsonDocuments;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads feedback signal definitions and answers lookups by name, type and triggering unit.
 * Definitions come from a directory of JSON files or from the classpath set {@code feedback_signals/index.json}.
 * Files that do not parse, or have no name or an unknown {@code signal_type}, are skipped with a warning.
 */
public final class FeedbackSignalRegistry {

    private static final Logger log = LoggerFactory.getLogger(FeedbackSignalRegistry.class);

    public static final String DOMAIN = "data-fabric";
    public static final String CLASSPATH_BASE = "feedback_signals";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<Map<String, String>>> CONSUMERS_TYPE = new TypeReference<>() { };

    private final Map<String, SignalDefinition> byName = new ConcurrentHashMap<>();

    /**
     * Loads from {@code signalsDir} when it is set and exists, otherwise from the classpath.
     *
     * @return number of definitions loaded
     */
    public int load(String signalsDir) {
        if (signalsDir != null && !signalsDir.isBlank() && Files.isDirectory(Path.of(signalsDir))) {
            return loadFromDirectory(Path.of(signalsDir));
        }
        return loadFromClasspath(FeedbackSignalRegistry.class.getClassLoader());
    }

    public int loadFromDirectory(Path dir) {
        try {
            return addAll(JsonDocuments.fromDirectory(dir), dir.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read signal definitions from " + dir, e);
        }
    }

    public int loadFromClasspath(ClassLoader loader) {
        try {
            return addAll(JsonDocuments.fromClasspath(loader, CLASSPATH_BASE), "classpath:" + CLASSPATH_BASE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read signal definitions from classpath:" + CLASSPATH_BASE, e);
        }
    }

    private int addAll(List<JsonDocuments.Document> documents, String source) {
        int loaded = 0;
        for (JsonDocuments.Document doc : documents) {
            Optional<SignalDefinition> def = parse(doc);
            if (def.isPresent()) {
                byName.put(def.get().name(), def.get());
                loaded++;
            }
        }
        log.info("Loaded {} feedback signal definitions from {}", loaded, source);
        return loaded;
    }

    private static Optional<SignalDefinition> parse(JsonDocuments.Document doc) {
        try {
            JsonNode root = FabricJson.mapper().readTree(doc.content());
            JsonNode metadata = root.path("metadata");
            String name = metadata.path("name").asText("");
            SignalType type = SignalType.fromValue(root.path("signal_type").asText(null));
            if (name.isBlank() || type == null) {
                log.warn("Skipping signal definition {}: missing name or invalid signal_type", doc.name());
                return Optional.empty();
            }
            JsonNode trigger = root.path("emission_trigger");
            List<String> units = new ArrayList<>();
            trigger.path("execution_units").forEach(u -> units.add(u.asText()));
            Map<String, Object> schema = root.has("schema")
                    ? FabricJson.mapper().convertValue(root.get("schema"), MAP_TYPE)
                    : Map.of();
            List<Map<String, String>> consumers = root.has("intended_consumers")
                    ? FabricJson.mapper().convertValue(root.get("intended_consumers"), CONSUMERS_TYPE)
                    : List.of();
            return Optional.of(new SignalDefinition(
                    name,
                    metadata.path("version").asText("1.0.0"),
                    metadata.path("domain").asText(DOMAIN),
                    type,
                    root.path("description").asText(""),
                    units,
                    EmissionCondition.fromValue(trigger.path("condition").asText(null)),
                    schema,
                    consumers));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping signal definition {}: {}", doc.name(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Returns the definition or null. */
    public SignalDefinition get(String name) {
        return name != null ? byName.get(name) : null;
    }

    public List<SignalDefinition> getAll() {
        List<SignalDefinition> out = new ArrayList<>(byName.values());
        out.sort((a, b) -> a.name().compareTo(b.name()));
        return out;
    }

    public List<SignalDefinition> getByType(SignalType type) {
        return getAll().stream().filter(d -> d.signalType() == type).toList();
    }

    public List<SignalDefinition> getMetrics() {
        return getByType(SignalType.METRIC);
    }

    public List<SignalDefinition> getOutcomes() {
        return getByType(SignalType.OUTCOME);
    }

    public List<SignalDefinition> getAdvisors() {
        return getByType(SignalType.ADVISOR);
    }

    /** Definitions whose trigger names the unit. */
    public List<SignalDefinition> getSignalsForExecutionUnit(String unitId) {
        return getAll().stream().filter(d -> d.isTriggeredBy(unitId)).toList();
    }

    /** Counts: metrics, outcomes, advisors, total. */
    public Map<String, Integer> getSignalCount() {
        Collection<SignalDefinition> all = byName.values();
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("metrics", (int) all.stream().filter(d -> d.signalType() == SignalType.METRIC).count());
        counts.put("outcomes", (int) all.stream().filter(d -> d.signalType() == SignalType.OUTCOME).count());
        counts.put("advisors", (int) all.stream().filter(d -> d.signalType() == SignalType.ADVISOR).count());
        counts.put("total", all.size());
        return counts;
    }

    public void clear() {
        byName.clear();
    }
}
