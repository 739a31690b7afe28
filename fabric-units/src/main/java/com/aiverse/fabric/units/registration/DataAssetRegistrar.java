package com.aiverse.fabric.units.registration;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.registration.AssetDeclaration;
import com.aiverse.fabric.contracts.registration.RegistrationResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.RegistryClient;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Registers a data asset as a registry card. Rejects declarations without name or version before touching
 * the registry.
 */
@FabricUnit(id = "DataAssetRegistrar", capabilityType = "data-registration",
        description = "Registers a data asset declaration as a registry card",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "write-registry",
        tags = {"registry", "metadata", "stateless"})
public final class DataAssetRegistrar extends TypedExecutionUnit<DataAssetRegistrar.Input, RegistrationResult> {

    public record Input(
            @JsonProperty("asset_declaration") AssetDeclaration assetDeclaration,
            @JsonProperty("owner_ref") UUID ownerRef) {

        public Input {
            Objects.requireNonNull(assetDeclaration, "asset_declaration");
        }
    }

    private final RegistryClient registryClient;

    public DataAssetRegistrar(RegistryClient registryClient) {
        super(Input.class);
        this.registryClient = Objects.requireNonNull(registryClient, "registryClient");
    }

    @Override
    public UnitOutput<RegistrationResult> run(Input input, TenantContext tenant) throws PortException {
        AssetDeclaration declaration = input.assetDeclaration();
        if (isBlank(declaration.name()) || isBlank(declaration.version())) {
            return UnitOutput.failure("INVALID_DECLARATION", "Asset name and version are required");
        }

        UUID owner = input.ownerRef() != null ? input.ownerRef() : declaration.ownerRef();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("schema", declaration.schemaDeclaration());
        metadata.put("location", declaration.storageLocationRef());
        metadata.put("classification", declaration.classification().value());
        metadata.put("format", declaration.dataFormat().value());
        metadata.put("owner", String.valueOf(owner));

        String cardRef;
        try {
            cardRef = registryClient.createCard(tenant, declaration.assetType(), declaration.name(),
                    declaration.version(), metadata);
        } catch (PortException e) {
            return switch (e.failure()) {
                case UNAVAILABLE -> UnitOutput.failure("REGISTRY_UNAVAILABLE", "Registry service is unavailable");
                case CONFLICT -> UnitOutput.failure("DUPLICATE_CONFLICT",
                        "Asset " + declaration.name() + ":" + declaration.version() + " already exists");
                case ACCESS_DENIED -> UnitOutput.failure("AUTHORIZATION_DENIED",
                        "Not authorized to register assets in this namespace");
                default -> throw e;
            };
        }

        return UnitOutput.success(new RegistrationResult(UUID.randomUUID(), cardRef, Instant.now()));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
