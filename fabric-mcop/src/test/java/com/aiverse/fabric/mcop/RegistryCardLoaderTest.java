package com.aiverse.fabric.mcop;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RegistryCardLoaderTest {

    @Test
    void discoversBundledCards() {
        List<RegistryCard> cards = new RegistryCardLoader(new InMemoryAssetRegistryClient()).discoverCards();

        assertEquals(22, cards.size());
        RegistryCard first = cards.get(0);
        assertEquals("DataAssetRegistrar", first.name());
        assertEquals("data-registration", first.capabilityType());
        assertEquals("data-fabric", first.domain());
        assertTrue(first.consumerIntents().contains("RegisterDataAsset"));
        assertTrue(first.failureModes().contains("EXECUTION_FAILED"));
    }

    @Test
    void bundledCardsAgreeWithCapabilityProfiles() {
        CapabilityProvider provider = new CapabilityProvider();
        for (RegistryCard card : new RegistryCardLoader(new InMemoryAssetRegistryClient()).discoverCards()) {
            CapabilityProfile profile = provider.getCapabilityProfile(card.name());
            assertNotNull(profile, card.name());
            assertEquals(profile.capabilityType(), card.capabilityType(), card.name());
        }
    }

    @Test
    void loadThenUnload_leavesNoResidue() throws McopException {
        InMemoryAssetRegistryClient client = new InMemoryAssetRegistryClient();
        RegistryCardLoader loader = new RegistryCardLoader(client);

        Map<String, UUID> loaded = loader.loadAll();

        assertEquals(22, loaded.size());
        assertEquals(22, loader.getCardCount());
        List<Map<String, Object>> listed = client.getCapabilitiesByDomain("data-fabric");
        assertEquals(22, listed.size());
        assertEquals("AggregationComputer", listed.get(0).get("name"));
        assertTrue(((Map<?, ?>) listed.get(0).get("metadata")).containsKey("registered_at"));

        assertTrue(loader.loadAll().isEmpty());

        Map<String, Boolean> unloaded = loader.unloadAll();

        assertEquals(22, unloaded.size());
        assertTrue(unloaded.values().stream().allMatch(b -> b));
        assertEquals(0, loader.getCardCount());
        assertEquals(0, client.size());
        assertTrue(client.getCapabilitiesByDomain("data-fabric").isEmpty());
    }

    @Test
    void directoryCards_invalidOnesSkipped(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a.json"), """
                {"metadata": {"name": "Alpha"}, "capability": {"type": "alpha-cap", "tags": ["x"]}}
                """);
        Files.writeString(dir.resolve("b.json"), """
                {"metadata": {"name": "NoCapability"}}
                """);
        Files.writeString(dir.resolve("c.json"), "{not json");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        List<RegistryCard> cards = new RegistryCardLoader(new InMemoryAssetRegistryClient(), dir.toString()).discoverCards();

        assertEquals(1, cards.size());
        assertEquals("Alpha", cards.get(0).name());
        assertEquals("1.0.0", cards.get(0).version());
        assertEquals(List.of("x"), cards.get(0).capabilityTags());
    }

    @Test
    void missingDirectory_discoversNothing(@TempDir Path dir) {
        RegistryCardLoader loader = new RegistryCardLoader(new InMemoryAssetRegistryClient(), dir.resolve("absent").toString());

        assertTrue(loader.discoverCards().isEmpty());
        assertTrue(loader.loadAll().isEmpty());
    }

    @Test
    void registryFailure_cardLeftOut() {
        AssetRegistryClient flaky = new AssetRegistryClient() {
            private final InMemoryAssetRegistryClient delegate = new InMemoryAssetRegistryClient();

            @Override
            public UUID registerCapability(RegistryCard card, Map<String, Object> metadata) throws McopException {
                if (card.name().equals("DataJoiner")) throw new McopException("conflict");
                return delegate.registerCapability(card, metadata);
            }

            @Override
            public boolean unregisterCapability(UUID cardId) {
                return delegate.unregisterCapability(cardId);
            }

            @Override
            public List<Map<String, Object>> getCapabilitiesByDomain(String domain) {
                return delegate.getCapabilitiesByDomain(domain);
            }
        };
        RegistryCardLoader loader = new RegistryCardLoader(flaky);

        Map<String, UUID> loaded = loader.loadAll();

        assertEquals(21, loaded.size());
        assertFalse(loader.getRegisteredCards().containsKey("DataJoiner"));
    }
}
