package com.aiverse.fabric.mcop;

import com.aiverse.fabric.contracts.LocalityType;
import com.aiverse.fabric.contracts.replication.LocalitySignal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityProviderTest {

    @Test
    void declaresTwentyTwoStatelessProfiles() {
        CapabilityProvider provider = new CapabilityProvider();

        assertEquals(22, provider.getCapabilityCount());
        for (CapabilityProfile p : provider.getAllProfiles().values()) {
            assertTrue(p.isStateless(), p.capabilityType());
        }
        CapabilityProfile extractor = provider.getCapabilityProfile("DataExtractor");
        assertEquals("data-extraction", extractor.capabilityType());
        assertEquals("cpu-medium", extractor.computeClass());
        assertNull(provider.getCapabilityProfile("Nope"));
        assertNull(provider.getCapabilityProfile(null));
    }

    @Test
    void everyIntentUnitHasAProfileWithMatchingCapability() {
        CapabilityProvider provider = new CapabilityProvider();
        for (Map.Entry<String, List<UnitReference>> e : DataFabricIntents.all().entrySet()) {
            for (UnitReference u : e.getValue()) {
                CapabilityProfile p = provider.getCapabilityProfile(u.name());
                assertNotNull(p, u.name());
                assertEquals(p.capabilityType(), u.capabilityType(), u.name());
            }
        }
    }

    @Test
    void withoutScheduler_everyCapabilityReportsProvided() {
        Map<String, Boolean> results = new CapabilityProvider().provideAllCapabilities();

        assertEquals(22, results.size());
        assertTrue(results.values().stream().allMatch(b -> b));
    }

    @Test
    void schedulerFailure_reportsFalseForThatUnitOnly() {
        CapabilityScheduler scheduler = new CapabilityScheduler() {
            @Override
            public boolean provideCapability(String name, CapabilityProfile profile) throws McopException {
                if (name.equals("DataJoiner")) throw new McopException("rejected");
                return true;
            }

            @Override
            public boolean provideLocalitySignals(UUID intentRef, String assetRef, List<LocalitySignal> signals)
                    throws McopException {
                throw new McopException("unreachable");
            }
        };
        CapabilityProvider provider = new CapabilityProvider(scheduler);

        Map<String, Boolean> results = provider.provideAllCapabilities();

        assertFalse(results.get("DataJoiner"));
        assertTrue(results.get("DataExtractor"));
        assertEquals(21, provider.getProvidedCapabilities().size());
        assertFalse(provider.getProvidedCapabilities().contains("DataJoiner"));
        assertFalse(provider.provideLocalitySignals(UUID.randomUUID(), "asset-1",
                List.of(new LocalitySignal("env-a", LocalityType.LOCAL, 0.0, 0.9))));
    }
}
