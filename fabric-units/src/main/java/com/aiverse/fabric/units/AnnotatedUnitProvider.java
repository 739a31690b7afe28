package com.aiverse.fabric.units;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.unit.ExecutionUnit;
import com.aiverse.fabric.unit.PortBindings;
import com.aiverse.fabric.unit.UnitProvider;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link UnitProvider} whose identity and capability metadata come from the unit class's {@link FabricUnit}
 * annotation.
 */
public final class AnnotatedUnitProvider implements UnitProvider {

    private final FabricUnit descriptor;
    private final List<Class<?>> requiredPorts;
    private final Function<PortBindings, ExecutionUnit> factory;

    public AnnotatedUnitProvider(Class<? extends ExecutionUnit> unitClass, List<Class<?>> requiredPorts,
                                 Function<PortBindings, ExecutionUnit> factory) {
        FabricUnit ann = unitClass.getAnnotation(FabricUnit.class);
        if (ann == null) {
            throw new IllegalArgumentException(unitClass.getName() + " is not annotated with @FabricUnit");
        }
        this.descriptor = ann;
        this.requiredPorts = List.copyOf(requiredPorts);
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public String getUnitId() {
        return descriptor.id();
    }

    @Override
    public String getCapabilityType() {
        return descriptor.capabilityType();
    }

    @Override
    public List<Class<?>> requiredPorts() {
        return requiredPorts;
    }

    @Override
    public ExecutionUnit createUnit(PortBindings ports) {
        return factory.apply(ports);
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("description", descriptor.description());
        meta.put("compute_class", descriptor.computeClass());
        meta.put("memory_requirements", descriptor.memoryRequirements());
        meta.put("io_pattern", descriptor.ioPattern());
        meta.put("tags", Arrays.asList(descriptor.tags()));
        return meta;
    }
}
