package com.aiverse.fabric.signals;

import com.aiverse.fabric.contracts.TenantContext;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One emitted signal as handed to the {@link ObservabilitySpine}.
 *
 * @param payload          {@code {intent_id, domain, ...values}}
 * @param intendedConsumer advisor target; null for metrics and outcomes
 */
public record FeedbackSignal(
        UUID emissionId,
        String name,
        SignalType signalType,
        String domain,
        TenantContext tenant,
        Map<String, Object> payload,
        String intendedConsumer,
        Instant timestamp) {
}
