package com.aiverse.fabric.unit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RestrictedAdapterClassLoaderTest {

    private final RestrictedAdapterClassLoader loader = new RestrictedAdapterClassLoader();

    @Test
    void allowsUnitApiContractsAndJdk() throws Exception {
        assertSame(PortProvider.class, loader.loadClass("com.aiverse.fabric.unit.PortProvider"));
        assertNotNull(loader.loadClass("com.aiverse.fabric.contracts.TenantContext"));
        assertNotNull(loader.loadClass("java.util.List"));
    }

    @Test
    void deniesInternalPackages() {
        assertFalse(RestrictedAdapterClassLoader.isAllowed("com.aiverse.fabric.worker.FabricWorkerApplication"));
        assertFalse(RestrictedAdapterClassLoader.isAllowed("com.aiverse.fabric.ledger.ExecutionLedger"));
        assertFalse(RestrictedAdapterClassLoader.isAllowed("com.aiverse.fabric.units.DataExtractor"));
        ClassNotFoundException e = assertThrows(ClassNotFoundException.class,
                () -> loader.loadClass("com.fasterxml.jackson.databind.ObjectMapper"));
        assertTrue(e.getMessage().startsWith("Access denied"));
    }
}
