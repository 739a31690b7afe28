package com.aiverse.fabric.unit;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.FabricJson;
import com.aiverse.fabric.contracts.TenantContext;

import java.util.Map;
import java.util.Objects;

/**
 * Execution unit with a typed input record. Converts the raw input map with {@link FabricJson}
 * and delegates to {@link #run}. Id and capability type come from the {@link FabricUnit} annotation
 * on the concrete class.
 *
 * @param <I> input record
 * @param <R> result record
 */
public abstract class TypedExecutionUnit<I, R> implements ExecutionUnit {

    private final Class<I> inputType;
    private final FabricUnit descriptor;

    protected TypedExecutionUnit(Class<I> inputType) {
        this.inputType = Objects.requireNonNull(inputType, "inputType");
        this.descriptor = getClass().getAnnotation(FabricUnit.class);
        if (descriptor == null) {
            throw new IllegalStateException(getClass().getName() + " is not annotated with @FabricUnit");
        }
    }

    @Override
    public String id() {
        return descriptor.id();
    }

    @Override
    public String capabilityType() {
        return descriptor.capabilityType();
    }

    public Class<I> inputType() {
        return inputType;
    }

    @Override
    public final UnitOutput<R> execute(Map<String, Object> inputs, TenantContext tenant) throws PortException {
        Objects.requireNonNull(tenant, "tenant");
        I input;
        try {
            input = FabricJson.convert(inputs != null ? inputs : Map.of(), inputType);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid input for " + id() + ": " + e.getMessage(), e);
        }
        return run(input, tenant);
    }

    /**
     * Runs the unit on a converted input. Declared port failures are returned as error codes; any
     * other {@link PortException} is rethrown.
     */
    public abstract UnitOutput<R> run(I input, TenantContext tenant) throws PortException;
}
