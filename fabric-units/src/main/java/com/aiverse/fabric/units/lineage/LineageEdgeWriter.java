package com.aiverse.fabric.units.lineage;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.lineage.LineageEdgeInput;
import com.aiverse.fabric.contracts.lineage.LineageEdgeResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.AssetRegistry;
import com.aiverse.fabric.unit.port.LineageStore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Records a directed lineage edge between two registered assets. Both endpoints must already exist. */
@FabricUnit(id = "LineageEdgeWriter", capabilityType = "lineage-recording",
        description = "Records lineage relationships between assets",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "write-registry",
        tags = {"lineage", "provenance", "stateless"})
public final class LineageEdgeWriter extends TypedExecutionUnit<LineageEdgeWriter.Input, LineageEdgeResult> {

    public record Input(@JsonProperty("edge_input") LineageEdgeInput edgeInput) {
        public Input {
            Objects.requireNonNull(edgeInput, "edge_input");
        }
    }

    private final AssetRegistry assetRegistry;
    private final LineageStore lineageStore;

    public LineageEdgeWriter(AssetRegistry assetRegistry, LineageStore lineageStore) {
        super(Input.class);
        this.assetRegistry = Objects.requireNonNull(assetRegistry, "assetRegistry");
        this.lineageStore = Objects.requireNonNull(lineageStore, "lineageStore");
    }

    @Override
    public UnitOutput<LineageEdgeResult> run(Input input, TenantContext tenant) throws PortException {
        LineageEdgeInput in = input.edgeInput();

        if (assetRegistry.getAsset(in.sourceAssetRef(), tenant) == null) {
            return UnitOutput.failure("SOURCE_NOT_FOUND", "Source asset not found: " + in.sourceAssetRef());
        }
        if (assetRegistry.getAsset(in.targetAssetRef(), tenant) == null) {
            return UnitOutput.failure("TARGET_NOT_FOUND", "Target asset not found: " + in.targetAssetRef());
        }

        try {
            lineageStore.createEdge(in.sourceAssetRef(), in.targetAssetRef(), in.relationshipType(),
                    in.executionRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.WRITE_FAILURE) {
                return UnitOutput.failure("REGISTRY_FAILURE", "Failed to create lineage edge: " + e.getMessage());
            }
            throw e;
        }

        return UnitOutput.success(new LineageEdgeResult(UUID.randomUUID(), Instant.now()));
    }
}
