package com.aiverse.fabric.mcop;

import com.aiverse.fabric.contracts.Copies;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed registry card: the capability advertisement of one execution unit.
 */
public record RegistryCard(
        String name,
        String version,
        String domain,
        String capabilityType,
        List<String> capabilityTags,
        String description,
        Map<String, Object> inputContract,
        Map<String, Object> outputContract,
        List<String> consumerIntents,
        List<String> failureModes) {

    public RegistryCard {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(capabilityType, "capabilityType");
        version = version != null ? version : "1.0.0";
        domain = domain != null ? domain : DataFabricIntents.DOMAIN;
        capabilityTags = Copies.list(capabilityTags);
        description = description != null ? description : "";
        inputContract = Copies.map(inputContract);
        outputContract = Copies.map(outputContract);
        consumerIntents = Copies.list(consumerIntents);
        failureModes = Copies.list(failureModes);
    }
}
