package com.aiverse.fabric.signals;

import com.aiverse.fabric.contracts.Copies;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed feedback signal definition. Declarative only: which units trigger it, when, and who consumes it.
 *
 * @param triggerUnits      execution unit ids whose completion emits this signal
 * @param intendedConsumers consumer entries ({@code consumer}, {@code purpose}) in declaration order
 */
public record SignalDefinition(
        String name,
        String version,
        String domain,
        SignalType signalType,
        String description,
        List<String> triggerUnits,
        EmissionCondition condition,
        Map<String, Object> schema,
        List<Map<String, String>> intendedConsumers) {

    public SignalDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(signalType, "signalType");
        triggerUnits = Copies.list(triggerUnits);
        condition = condition != null ? condition : EmissionCondition.ALWAYS;
        schema = Copies.map(schema);
        intendedConsumers = Copies.list(intendedConsumers);
    }

    public boolean isTriggeredBy(String unitId) {
        return triggerUnits.contains(unitId);
    }

    /** First intended consumer, or {@code unknown}. */
    public String primaryConsumer() {
        if (intendedConsumers.isEmpty()) return "unknown";
        String c = intendedConsumers.get(0).get("consumer");
        return c != null && !c.isBlank() ? c : "unknown";
    }
}
