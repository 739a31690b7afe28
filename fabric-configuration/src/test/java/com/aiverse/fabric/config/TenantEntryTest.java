package com.aiverse.fabric.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TenantEntryTest {

    @Test
    void parse_readsIdsNamesAndConfig() {
        List<TenantEntry> entries = TenantEntry.parse("["
                + "{\"id\": \" acme/ws1 \", \"name\": \"Acme\", \"config\": {\"rateLimits\": {\"write\": 20}}},"
                + "{\"id\": \"globex/ws1\"},"
                + "{\"name\": \"no id\"},"
                + "{\"id\": \"acme/ws1\", \"config\": {\"rateLimits\": {\"write\": 5}}}"
                + "]");

        assertEquals(2, entries.size());
        assertEquals("acme/ws1", entries.get(0).getId());
        assertEquals("Acme", entries.get(0).getName());
        assertEquals(Map.of("write", 20), entries.get(0).getConfig().get("rateLimits"));
        assertEquals("globex/ws1", entries.get(1).getId());
        assertTrue(entries.get(1).getConfig().isEmpty());
    }

    @Test
    void parse_blankIsEmpty() {
        assertTrue(TenantEntry.parse(null).isEmpty());
        assertTrue(TenantEntry.parse("  ").isEmpty());
    }

    @Test
    void parse_rejectsNonArrayAndMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> TenantEntry.parse("{\"id\": \"acme\"}"));
        assertThrows(IllegalArgumentException.class, () -> TenantEntry.parse("[{\"id\": "));
    }

    @Test
    void registeredConfigFeedsNestedLimits() {
        TenantConfigRegistry registry = TenantConfigRegistry.getInstance();
        try {
            TenantEntry entry = TenantEntry.parse("[{\"id\":\"acme\",\"config\":{\"rateLimits\":{\"compute\":\"7\"}}}]").get(0);
            registry.put(entry.getId(), entry.getConfig());

            assertEquals(7, registry.get("acme").getNestedInt("rateLimits", "compute", 50));
            assertTrue(registry.remove("acme"));
            assertEquals(50, registry.get("acme").getNestedInt("rateLimits", "compute", 50));
        } finally {
            registry.clear();
        }
    }
}
