package com.aiverse.fabric.contracts.registration;

import com.aiverse.fabric.contracts.AssetType;
import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.DataClassification;
import com.aiverse.fabric.contracts.DataFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/** Declaration of a data asset to be registered as a registry card. */
public record AssetDeclaration(
        @JsonProperty("asset_type") AssetType assetType,
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("schema_declaration") Map<String, Object> schemaDeclaration,
        @JsonProperty("storage_location_ref") String storageLocationRef,
        @JsonProperty("classification") DataClassification classification,
        @JsonProperty("data_format") DataFormat dataFormat,
        @JsonProperty("owner_ref") UUID ownerRef) {

    public AssetDeclaration {
        Objects.requireNonNull(assetType, "asset_type");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(dataFormat, "data_format");
        schemaDeclaration = Copies.map(schemaDeclaration);
    }
}
