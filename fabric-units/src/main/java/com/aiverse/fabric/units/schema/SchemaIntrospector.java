package com.aiverse.fabric.units.schema;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.schema.FieldDefinition;
import com.aiverse.fabric.contracts.schema.SchemaIntrospectionInput;
import com.aiverse.fabric.contracts.schema.SchemaIntrospectionResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.SchemaReader;
import com.aiverse.fabric.unit.port.SchemaReader.SchemaSnapshot;
import com.aiverse.fabric.unit.port.SchemaReader.SourceField;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Discovers the schema of an external source. Schemas wider than {@value #MAX_FIELDS} fields are cut. */
@FabricUnit(id = "SchemaIntrospector", capabilityType = "schema-discovery",
        description = "Discovers fields, keys and sample values of a source",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "read-external",
        tags = {"schema", "discovery", "stateless"})
public final class SchemaIntrospector
        extends TypedExecutionUnit<SchemaIntrospector.Input, SchemaIntrospectionResult> {

    public static final int MAX_FIELDS = 1000;

    public record Input(@JsonProperty("introspection_input") SchemaIntrospectionInput introspectionInput) {
        public Input {
            Objects.requireNonNull(introspectionInput, "introspection_input");
        }
    }

    private final SchemaReader schemaReader;

    public SchemaIntrospector(SchemaReader schemaReader) {
        super(Input.class);
        this.schemaReader = Objects.requireNonNull(schemaReader, "schemaReader");
    }

    @Override
    public UnitOutput<SchemaIntrospectionResult> run(Input input, TenantContext tenant) throws PortException {
        SchemaIntrospectionInput in = input.introspectionInput();

        SchemaSnapshot snapshot;
        try {
            snapshot = schemaReader.readSchema(in.connectionRef(), in.sourcePath(), in.sampleSize(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case NETWORK, UNAVAILABLE -> UnitOutput.failure("CONNECTION_FAILURE", "Failed to connect to data source");
                case ACCESS_DENIED -> UnitOutput.failure("ACCESS_DENIED", "Access denied to source");
                case NOT_FOUND -> UnitOutput.failure("SOURCE_NOT_FOUND", "Source not found: " + in.sourcePath());
                default -> throw e;
            };
        }

        Set<String> keys = new HashSet<>(snapshot.primaryKeys());
        List<FieldDefinition> fields = new ArrayList<>(snapshot.fields().size());
        for (SourceField f : snapshot.fields()) {
            boolean nullable = f.nullable() == null || f.nullable();
            fields.add(new FieldDefinition(f.name(), f.type(), nullable, keys.contains(f.name())));
        }

        boolean truncated = fields.size() > MAX_FIELDS;
        if (truncated) {
            fields = fields.subList(0, MAX_FIELDS);
        }

        SchemaIntrospectionResult result = new SchemaIntrospectionResult(fields, snapshot.primaryKeys(),
                snapshot.rowCountEstimate(), snapshot.sampleValues(), Instant.now());
        return UnitOutput.success(result).withTruncated(truncated);
    }
}
