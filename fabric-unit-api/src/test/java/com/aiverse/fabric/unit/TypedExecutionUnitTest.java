package com.aiverse.fabric.unit;

import com.aiverse.fabric.contracts.TenantContext;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TypedExecutionUnitTest {

    private final TenantContext tenant = new TenantContext(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

    @Test
    void idAndCapabilityComeFromAnnotation() {
        EchoUnit unit = new EchoUnit();
        assertEquals("Echo", unit.id());
        assertEquals("echo", unit.capabilityType());
    }

    @Test
    void execute_convertsMapInputAndRunsWithTenant() throws Exception {
        UnitOutput<EchoUnit.Result> out = new EchoUnit().execute(Map.of("text", "hi"), tenant);

        assertTrue(out.isSuccess());
        assertEquals("hi", out.result().text());
        assertEquals(tenant.tenantId(), out.result().tenantId());
    }

    @Test
    void execute_invalidInputIsIllegalArgument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new EchoUnit().execute(Map.of("other", 1), tenant));
        assertTrue(e.getMessage().startsWith("Invalid input for Echo"));
    }

    @Test
    void execute_unmappedPortFailurePropagates() {
        PortException e = assertThrows(PortException.class,
                () -> new EchoUnit().execute(Map.of("text", "x", "fail_with", "TIMEOUT"), tenant));
        assertEquals(PortFailure.TIMEOUT, e.failure());
    }

    @Test
    void execute_requiresTenant() {
        assertThrows(NullPointerException.class, () -> new EchoUnit().execute(Map.of("text", "x"), null));
    }
}
