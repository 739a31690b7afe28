package com.aiverse.fabric.unit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UnitRegistryTest {

    private final UnitRegistry registry = UnitRegistry.getInstance();

    @AfterEach
    void tearDown() {
        registry.clear();
    }

    @Test
    void register_isScopedPerTenant() {
        registry.register("org-a/ws-1", new EchoUnit(), "1.0", Map.of("compute_class", "cpu-small"));

        assertNotNull(registry.getExecutable("org-a/ws-1", "Echo"));
        assertNull(registry.getExecutable("org-b/ws-1", "Echo"));
        assertEquals("cpu-small", registry.get("org-a/ws-1", "Echo").getCapabilityMetadata().get("compute_class"));
    }

    @Test
    void register_duplicateInSameTenantFails() {
        registry.register("t", new EchoUnit());
        assertThrows(IllegalArgumentException.class, () -> registry.register("t", new EchoUnit()));
        registry.register("other", new EchoUnit());
    }

    @Test
    void blankTenantMapsToDefault() {
        registry.register(" ", new EchoUnit());
        assertNotNull(registry.get("default", "Echo"));
        assertNotNull(registry.get(null, "Echo"));
    }

    @Test
    void findByCapability_andListIds() {
        registry.register("t", new EchoUnit());

        assertEquals(1, registry.findByCapability("t", "echo").size());
        assertTrue(registry.findByCapability("t", "data-joining").isEmpty());
        assertEquals(List.of("Echo"), registry.listUnitIds("t"));
    }

    @Test
    void unregister_leavesNoTenantResidue() {
        registry.register("t", new EchoUnit());

        assertTrue(registry.unregister("t", "Echo"));
        assertFalse(registry.unregister("t", "Echo"));
        assertTrue(registry.getAllByTenant().isEmpty());
    }
}
