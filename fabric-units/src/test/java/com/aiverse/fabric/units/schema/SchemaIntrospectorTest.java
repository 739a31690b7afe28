package com.aiverse.fabric.units.schema;

import com.aiverse.fabric.contracts.schema.FieldDefinition;
import com.aiverse.fabric.contracts.schema.SchemaIntrospectionInput;
import com.aiverse.fabric.contracts.schema.SchemaIntrospectionResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.SchemaReader.SchemaSnapshot;
import com.aiverse.fabric.unit.port.SchemaReader.SourceField;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static org.junit.jupiter.api.Assertions.*;

class SchemaIntrospectorTest {

    private final SchemaIntrospector.Input input =
            new SchemaIntrospector.Input(new SchemaIntrospectionInput("conn", "public.orders", 10));

    @Test
    void run_mapsFieldsAndMarksKeys() throws Exception {
        SchemaIntrospector unit = new SchemaIntrospector((conn, path, sample, tenant) -> new SchemaSnapshot(
                List.of(new SourceField("id", "bigint", false), new SourceField("note", "text", null)),
                List.of("id"), 42, Map.of("id", List.of(1, 2))));

        UnitOutput<SchemaIntrospectionResult> out = unit.run(input, TENANT);

        assertTrue(out.isSuccess());
        assertFalse(out.isTruncated());
        List<FieldDefinition> fields = out.result().fields();
        assertEquals(new FieldDefinition("id", "bigint", false, true), fields.get(0));
        assertEquals(new FieldDefinition("note", "text", true, false), fields.get(1));
        assertEquals(42, out.result().rowCountEstimate());
    }

    @Test
    void run_truncatesWideSchemas() throws Exception {
        List<SourceField> wide = new ArrayList<>();
        for (int i = 0; i < SchemaIntrospector.MAX_FIELDS + 5; i++) {
            wide.add(new SourceField("c" + i, "int", true));
        }
        SchemaIntrospector unit = new SchemaIntrospector((conn, path, sample, tenant) ->
                new SchemaSnapshot(wide, List.of(), 0, Map.of()));

        UnitOutput<SchemaIntrospectionResult> out = unit.run(input, TENANT);

        assertTrue(out.isSuccess());
        assertTrue(out.isTruncated());
        assertEquals(SchemaIntrospector.MAX_FIELDS, out.result().fields().size());
    }

    @Test
    void run_mapsReaderFailures() throws Exception {
        assertEquals("CONNECTION_FAILURE", failWith(PortFailure.NETWORK).errorCode());
        assertEquals("CONNECTION_FAILURE", failWith(PortFailure.UNAVAILABLE).errorCode());
        assertEquals("ACCESS_DENIED", failWith(PortFailure.ACCESS_DENIED).errorCode());
        UnitOutput<SchemaIntrospectionResult> missing = failWith(PortFailure.NOT_FOUND);
        assertEquals("SOURCE_NOT_FOUND", missing.errorCode());
        assertEquals("Source not found: public.orders", missing.errorMessage());
    }

    private UnitOutput<SchemaIntrospectionResult> failWith(PortFailure failure) throws PortException {
        return new SchemaIntrospector((conn, path, sample, tenant) -> {
            throw new PortException(failure, "boom");
        }).run(input, TENANT);
    }
}
