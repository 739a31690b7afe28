package com.aiverse.fabric.ledger;

import com.aiverse.fabric.annotations.FabricFeature;
import com.aiverse.fabric.annotations.FeaturePhase;
import com.aiverse.fabric.features.FinallyCall;
import com.aiverse.fabric.features.UnitExecutionContext;

import java.util.Map;

/**
 * Records every unit run of an intent execution in the ledger: input, output map, outcome, error code and duration.
 * Invocations outside an intent (no execution id) are not recorded.
 */
@FabricFeature(name = "ledger", phase = FeaturePhase.FINALLY, applicableUnits = { "*" })
public final class LedgerFeature implements FinallyCall {

    /** Attribute holding the unit input map. */
    public static final String ATTR_INPUT = "input";

    private final ExecutionLedger ledger;

    public LedgerFeature(ExecutionLedger ledger) {
        this.ledger = ledger != null ? ledger : new ExecutionLedger(new InMemoryExecutionStore());
    }

    @Override
    @SuppressWarnings("unchecked")
    public void afterFinally(UnitExecutionContext context, Object unitResult) {
        String executionId = context.getExecutionId();
        if (executionId == null || executionId.isBlank()) {
            return;
        }
        Map<String, Object> input = context.getAttribute(ATTR_INPUT, Map.class);
        Map<String, Object> output = unitResult instanceof Map ? (Map<String, Object>) unitResult : Map.of();
        Object message = output.get("error_message");
        ledger.unitRecorded(new UnitRecord(
                executionId,
                context.getUnitId(),
                context.getCapabilityType(),
                input,
                output,
                context.isExecutionSucceeded(),
                context.getErrorCode(),
                message != null ? message.toString() : null,
                ledger.now(),
                context.getDurationMs()));
    }
}
