package com.aiverse.fabric.mcop;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Result of {@link IntentHandler#handleIntent}. On failure only {@code error} and {@code domain} are meaningful.
 */
public record IntentHandlingResult(
        boolean success,
        UUID intentId,
        UUID executionId,
        String intentType,
        String domain,
        List<Map<String, Object>> executionUnits,
        String error) {

    public IntentHandlingResult {
        executionUnits = executionUnits != null ? List.copyOf(executionUnits) : List.of();
    }

    static IntentHandlingResult failure(String domain, String error) {
        return new IntentHandlingResult(false, null, null, null, domain, List.of(), error);
    }

    public int unitCount() {
        return executionUnits.size();
    }

    /**
     * Map form: {@code {success, intent_id, execution_id, intent_type, domain, execution_units, unit_count}} on success,
     * {@code {success, error, domain}} on failure.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("success", success);
        if (!success) {
            m.put("error", error);
            m.put("domain", domain);
            return m;
        }
        m.put("intent_id", intentId.toString());
        m.put("execution_id", executionId.toString());
        m.put("intent_type", intentType);
        m.put("domain", domain);
        m.put("execution_units", executionUnits);
        m.put("unit_count", unitCount());
        return m;
    }
}
