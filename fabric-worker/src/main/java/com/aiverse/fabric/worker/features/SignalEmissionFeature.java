package com.aiverse.fabric.worker.features;

import com.aiverse.fabric.annotations.FabricFeature;
import com.aiverse.fabric.annotations.FeaturePhase;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.features.FinallyCall;
import com.aiverse.fabric.features.UnitExecutionContext;
import com.aiverse.fabric.signals.EmissionResult;
import com.aiverse.fabric.signals.FeedbackSignalEmitter;
import com.aiverse.fabric.worker.engine.UnitInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Emits the feedback signals triggered by a unit once it has run. Needs the tenant and intent id attributes set
 * by {@link UnitInvoker}; invocations without them emit nothing.
 */
@FabricFeature(name = "signals", phase = FeaturePhase.FINALLY, applicableUnits = { "*" })
public final class SignalEmissionFeature implements FinallyCall {

    private static final Logger log = LoggerFactory.getLogger(SignalEmissionFeature.class);

    private final FeedbackSignalEmitter emitter;

    public SignalEmissionFeature(FeedbackSignalEmitter emitter) {
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    @Override
    @SuppressWarnings("unchecked")
    public void afterFinally(UnitExecutionContext context, Object unitResult) {
        TenantContext tenant = context.getAttribute(UnitInvoker.ATTR_TENANT, TenantContext.class);
        UUID intentId = context.getAttribute(UnitInvoker.ATTR_INTENT_ID, UUID.class);
        if (tenant == null || intentId == null) {
            return;
        }
        Map<String, Object> output = unitResult instanceof Map ? (Map<String, Object>) unitResult : Map.of();
        List<EmissionResult> results = emitter.emitForExecutionUnit(context.getUnitId(), intentId, tenant, output,
                context.isExecutionSucceeded());
        for (EmissionResult r : results) {
            if (!r.success()) {
                log.warn("Signal {} for unit {} was not delivered: {}", r.signalName(), context.getUnitId(), r.error());
            }
        }
    }
}
