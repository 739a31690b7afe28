package com.aiverse.fabric.signals;

import com.aiverse.fabric.contracts.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Emits feedback signals to the {@link ObservabilitySpine} and keeps a record of the most recent emissions
 * (at most {@value #DEFAULT_HISTORY_LIMIT} unless configured otherwise). Counts cover every emission since the
 * last {@link #clear()}, including those dropped from the history.
 * A signal must be defined in the {@link FeedbackSignalRegistry} with the requested type. Without a spine
 * emissions are recorded as successful.
 */
public final class FeedbackSignalEmitter {

    private static final Logger log = LoggerFactory.getLogger(FeedbackSignalEmitter.class);

    public static final String DOMAIN = FeedbackSignalRegistry.DOMAIN;

    public static final int DEFAULT_HISTORY_LIMIT = 1000;

    private final ObservabilitySpine spine;
    private final FeedbackSignalRegistry registry;
    private final Clock clock;
    private final int historyLimit;

    // history and counters are guarded by the emissions lock
    private final Deque<EmissionResult> emissions = new ArrayDeque<>();
    private int total;
    private int successful;
    private final Map<SignalType, Integer> byType = new EnumMap<>(SignalType.class);

    public FeedbackSignalEmitter(ObservabilitySpine spine, FeedbackSignalRegistry registry) {
        this(spine, registry, Clock.systemUTC(), DEFAULT_HISTORY_LIMIT);
    }

    public FeedbackSignalEmitter(ObservabilitySpine spine, FeedbackSignalRegistry registry, Clock clock) {
        this(spine, registry, clock, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * @param historyLimit number of recent emissions kept for {@link #getEmissions()}; must be positive
     */
    public FeedbackSignalEmitter(ObservabilitySpine spine, FeedbackSignalRegistry registry, Clock clock,
                                 int historyLimit) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        }
        this.spine = spine;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.historyLimit = historyLimit;
    }

    public EmissionResult emitMetric(String name, UUID intentId, TenantContext tenant, Map<String, Object> values) {
        return emit(name, SignalType.METRIC, intentId, tenant, values, null);
    }

    public EmissionResult emitOutcome(String name, UUID intentId, TenantContext tenant, Map<String, Object> values) {
        return emit(name, SignalType.OUTCOME, intentId, tenant, values, null);
    }

    public EmissionResult emitAdvisor(String name, UUID intentId, TenantContext tenant, Map<String, Object> values,
                                      String intendedConsumer) {
        return emit(name, SignalType.ADVISOR, intentId, tenant, values, intendedConsumer);
    }

    private EmissionResult emit(String name, SignalType type, UUID intentId, TenantContext tenant,
                                Map<String, Object> values, String consumer) {
        UUID emissionId = UUID.randomUUID();
        var now = clock.instant();
        SignalDefinition def = registry.get(name);
        if (def == null || def.signalType() != type) {
            // not recorded: nothing was sent
            return EmissionResult.failed(name, type, emissionId, now, "Unknown " + type.value() + ": " + name);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("intent_id", intentId != null ? intentId.toString() : null);
        payload.put("domain", DOMAIN);
        if (values != null) payload.putAll(values);

        EmissionResult result;
        if (spine == null) {
            result = new EmissionResult(name, type, true, emissionId, now, null);
        } else {
            try {
                boolean accepted = spine.publish(new FeedbackSignal(emissionId, name, type, DOMAIN, tenant,
                        payload, consumer, now));
                result = new EmissionResult(name, type, accepted, emissionId, now,
                        accepted ? null : "Spine rejected signal");
            } catch (RuntimeException e) {
                log.warn("Emission of {} {} failed: {}", type.value(), name, e.getMessage());
                result = EmissionResult.failed(name, type, emissionId, now, e.getMessage());
            }
        }
        record(result);
        return result;
    }

    /**
     * Emits every signal triggered by the unit whose condition matches the outcome. Advisors go to their first
     * intended consumer.
     *
     * @param executionResult map form of the unit output, used as signal values
     */
    public List<EmissionResult> emitForExecutionUnit(String unitId, UUID intentId, TenantContext tenant,
                                                     Map<String, Object> executionResult, boolean success) {
        List<EmissionResult> results = new ArrayList<>();
        for (SignalDefinition def : registry.getSignalsForExecutionUnit(unitId)) {
            if (!def.condition().matches(success)) continue;
            results.add(switch (def.signalType()) {
                case METRIC -> emitMetric(def.name(), intentId, tenant, executionResult);
                case OUTCOME -> emitOutcome(def.name(), intentId, tenant, executionResult);
                case ADVISOR -> emitAdvisor(def.name(), intentId, tenant, executionResult, def.primaryConsumer());
            });
        }
        return results;
    }

    private void record(EmissionResult result) {
        synchronized (emissions) {
            if (emissions.size() == historyLimit) {
                emissions.removeFirst();
            }
            emissions.addLast(result);
            total++;
            if (result.success()) successful++;
            byType.merge(result.signalType(), 1, Integer::sum);
        }
    }

    /** Most recent emissions, oldest first. */
    public List<EmissionResult> getEmissions() {
        synchronized (emissions) {
            return List.copyOf(emissions);
        }
    }

    /** Counts: total, successful, failed, metrics, outcomes, advisors. */
    public Map<String, Integer> getEmissionCount() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        synchronized (emissions) {
            counts.put("total", total);
            counts.put("successful", successful);
            counts.put("failed", total - successful);
            counts.put("metrics", byType.getOrDefault(SignalType.METRIC, 0));
            counts.put("outcomes", byType.getOrDefault(SignalType.OUTCOME, 0));
            counts.put("advisors", byType.getOrDefault(SignalType.ADVISOR, 0));
        }
        return counts;
    }

    public void clear() {
        synchronized (emissions) {
            emissions.clear();
            total = 0;
            successful = 0;
            byType.clear();
        }
    }
}
