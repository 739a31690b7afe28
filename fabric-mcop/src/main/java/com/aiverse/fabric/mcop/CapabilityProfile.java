package com.aiverse.fabric.mcop;

import java.util.List;
import java.util.Objects;

/** Scheduling profile of an execution unit, advertised to MCOP. */
public record CapabilityProfile(
        String capabilityType,
        String computeClass,
        String memoryRequirements,
        String ioPattern,
        List<String> tags) {

    public CapabilityProfile {
        Objects.requireNonNull(capabilityType, "capabilityType");
        Objects.requireNonNull(computeClass, "computeClass");
        Objects.requireNonNull(memoryRequirements, "memoryRequirements");
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean isStateless() {
        return tags.contains("stateless");
    }
}
