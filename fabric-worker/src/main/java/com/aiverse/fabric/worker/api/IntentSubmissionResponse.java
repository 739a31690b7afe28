package com.aiverse.fabric.worker.api;

import java.util.LinkedHashMap;
import java.util.Map;

/** Answer to an accepted intent submission. {@code status} is the lowercase execution status. */
public record IntentSubmissionResponse(String intentId, String status, String executionId, String traceId) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("intent_id", intentId);
        m.put("status", status);
        m.put("execution_id", executionId);
        m.put("trace_id", traceId);
        return m;
    }
}
