package com.aiverse.fabric.mcop;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.TenantContext;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An intent split into execution units, as submitted to the {@link IntentEngine}.
 *
 * @param executionId id under which the execution of this decomposition is tracked
 * @param inputs      raw intent inputs; each unit resolves its own input with {@link UnitReference#resolveInputs}
 */
public record IntentDecomposition(
        UUID intentId,
        UUID executionId,
        String intentType,
        String domain,
        TenantContext tenant,
        Map<String, Object> inputs,
        List<UnitReference> units) {

    public IntentDecomposition {
        Objects.requireNonNull(intentId, "intentId");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(intentType, "intentType");
        inputs = Copies.map(inputs);
        units = Copies.list(units);
    }
}
