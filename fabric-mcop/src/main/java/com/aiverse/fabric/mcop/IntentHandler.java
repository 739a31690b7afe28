package com.aiverse.fabric.mcop;

import com.aiverse.fabric.contracts.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Decomposes data-fabric intents into execution units and submits the decomposition to the MCOP intent engine.
 * Never executes units itself.
 */
public final class IntentHandler {

    private static final Logger log = LoggerFactory.getLogger(IntentHandler.class);

    public static final String DOMAIN = DataFabricIntents.DOMAIN;

    private final IntentEngine intentEngine;

    /** Handler without an engine: decompositions are returned but not submitted. */
    public IntentHandler() {
        this(null);
    }

    public IntentHandler(IntentEngine intentEngine) {
        this.intentEngine = intentEngine;
    }

    /** Units for the intent, or null if the intent is not a data-fabric intent. */
    public List<UnitReference> getExecutionUnitsForIntent(String intentType) {
        return DataFabricIntents.unitsFor(intentType);
    }

    public boolean isSupportedIntent(String intentType) {
        return intentType != null && DataFabricIntents.all().containsKey(intentType);
    }

    /** Handles an intent under a newly generated execution id. */
    public IntentHandlingResult handleIntent(String intentType, UUID intentId, TenantContext tenant, Map<String, Object> inputs) {
        return handleIntent(intentType, intentId, UUID.randomUUID(), tenant, inputs);
    }

    /**
     * Decomposes the intent and, when an engine is configured, submits the decomposition. A decomposition the
     * engine declines or fails to accept yields a failed result.
     */
    public IntentHandlingResult handleIntent(String intentType, UUID intentId, UUID executionId, TenantContext tenant,
                                             Map<String, Object> inputs) {
        if (!isSupportedIntent(intentType)) {
            return IntentHandlingResult.failure(DOMAIN, "Unsupported intent type: " + intentType);
        }
        List<UnitReference> units = getExecutionUnitsForIntent(intentType);
        if (units == null || units.isEmpty()) {
            return IntentHandlingResult.failure(DOMAIN, "No execution units mapped for intent: " + intentType);
        }

        List<Map<String, Object>> specs = new ArrayList<>(units.size());
        for (UnitReference u : units) {
            specs.add(u.toSpec(DOMAIN));
        }

        if (intentEngine != null) {
            IntentDecomposition decomposition = new IntentDecomposition(intentId, executionId, intentType, DOMAIN, tenant, inputs, units);
            try {
                if (!intentEngine.decomposeIntent(decomposition)) {
                    return IntentHandlingResult.failure(DOMAIN, "Failed to submit decomposition: rejected by intent engine");
                }
            } catch (McopException | RuntimeException e) {
                log.warn("Intent {} ({}) decomposition not accepted: {}", intentId, intentType, e.getMessage(), e);
                return IntentHandlingResult.failure(DOMAIN, "Failed to submit decomposition: " + e.getMessage());
            }
        }
        log.debug("Intent {} ({}) decomposed into {} unit(s)", intentId, intentType, specs.size());
        return new IntentHandlingResult(true, intentId, executionId, intentType, DOMAIN, specs, null);
    }

    /** Supported intent types, sorted. */
    public List<String> getSupportedIntents() {
        return List.copyOf(new TreeSet<>(DataFabricIntents.all().keySet()));
    }

    public int getIntentCount() {
        return DataFabricIntents.all().size();
    }
}
