package com.aiverse.fabric.mcop;

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
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads the data-fabric registry cards and registers them with the asset registry. Tracks what it registered
 * so {@link #unloadAll()} can remove the domain without residue.
 * <p>
 * Cards come from {@code cardsDir} when set, otherwise from the classpath set {@code registry_cards/index.json}.
 * A card that does not parse or lacks {@code metadata.name} or {@code capability.type} is skipped with a warning.
 */
public final class RegistryCardLoader {

    private static final Logger log = LoggerFactory.getLogger(RegistryCardLoader.class);

    public static final String CLASSPATH_BASE = "registry_cards";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRINGS_TYPE = new TypeReference<>() { };

    private final AssetRegistryClient registryClient;
    private final Path cardsDir;
    private final Clock clock;
    private final Map<String, UUID> registered = new LinkedHashMap<>();

    public RegistryCardLoader(AssetRegistryClient registryClient) {
        this(registryClient, null, Clock.systemUTC());
    }

    public RegistryCardLoader(AssetRegistryClient registryClient, String cardsDir) {
        this(registryClient, cardsDir != null && !cardsDir.isBlank() ? Path.of(cardsDir) : null, Clock.systemUTC());
    }

    public RegistryCardLoader(AssetRegistryClient registryClient, Path cardsDir, Clock clock) {
        this.registryClient = Objects.requireNonNull(registryClient, "registryClient");
        this.cardsDir = cardsDir;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /** Parses all cards without registering them. */
    public List<RegistryCard> discoverCards() {
        List<JsonDocuments.Document> documents;
        try {
            if (cardsDir != null) {
                if (!Files.isDirectory(cardsDir)) {
                    log.warn("Registry cards directory {} does not exist", cardsDir);
                    return List.of();
                }
                documents = JsonDocuments.fromDirectory(cardsDir);
            } else {
                documents = JsonDocuments.fromClasspath(RegistryCardLoader.class.getClassLoader(), CLASSPATH_BASE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read registry cards", e);
        }
        List<RegistryCard> cards = new ArrayList<>();
        for (JsonDocuments.Document doc : documents) {
            parse(doc).ifPresent(cards::add);
        }
        return cards;
    }

    static Optional<RegistryCard> parse(JsonDocuments.Document doc) {
        try {
            JsonNode root = FabricJson.mapper().readTree(doc.content());
            JsonNode metadata = root.path("metadata");
            JsonNode capability = root.path("capability");
            String name = metadata.path("name").asText("");
            String type = capability.path("type").asText("");
            if (name.isBlank() || type.isBlank()) {
                log.warn("Skipping registry card {}: missing metadata.name or capability.type", doc.name());
                return Optional.empty();
            }
            return Optional.of(new RegistryCard(
                    name,
                    metadata.path("version").asText("1.0.0"),
                    metadata.path("domain").asText(DataFabricIntents.DOMAIN),
                    type,
                    strings(capability.get("tags")),
                    capability.path("description").asText(""),
                    map(root.get("input_contract")),
                    map(root.get("output_contract")),
                    strings(root.get("consumer_intents")),
                    strings(root.get("failure_modes"))));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping registry card {}: {}", doc.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> strings(JsonNode node) {
        return node != null && node.isArray() ? FabricJson.mapper().convertValue(node, STRINGS_TYPE) : List.of();
    }

    private static Map<String, Object> map(JsonNode node) {
        return node != null && node.isObject() ? FabricJson.mapper().convertValue(node, MAP_TYPE) : Map.of();
    }

    /**
     * Registers every discovered card not yet registered by this loader. A card the registry rejects is logged
     * and left out.
     *
     * @return card name to registry id for the cards registered by this call
     */
    public synchronized Map<String, UUID> loadAll() {
        Map<String, UUID> results = new LinkedHashMap<>();
        for (RegistryCard card : discoverCards()) {
            if (registered.containsKey(card.name())) {
                log.debug("Registry card {} already registered; skipping", card.name());
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("failure_modes", card.failureModes());
            metadata.put("registered_at", clock.instant().toString());
            try {
                UUID id = registryClient.registerCapability(card, metadata);
                results.put(card.name(), id);
                registered.put(card.name(), id);
            } catch (McopException | RuntimeException e) {
                log.warn("Failed to register card {}: {}", card.name(), e.getMessage());
            }
        }
        log.info("Registered {} registry card(s); {} total", results.size(), registered.size());
        return results;
    }

    /**
     * Unregisters every card this loader registered. Cards the registry fails to remove stay tracked.
     *
     * @return card name to outcome
     */
    public synchronized Map<String, Boolean> unloadAll() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (Map.Entry<String, UUID> e : new ArrayList<>(registered.entrySet())) {
            boolean ok;
            try {
                ok = registryClient.unregisterCapability(e.getValue());
            } catch (McopException | RuntimeException ex) {
                log.warn("Failed to unregister card {}: {}", e.getKey(), ex.getMessage());
                ok = false;
            }
            results.put(e.getKey(), ok);
            if (ok) registered.remove(e.getKey());
        }
        log.info("Unregistered {} registry card(s); {} remain", results.values().stream().filter(b -> b).count(), registered.size());
        return results;
    }

    public synchronized Map<String, UUID> getRegisteredCards() {
        return Map.copyOf(registered);
    }

    public synchronized int getCardCount() {
        return registered.size();
    }
}
