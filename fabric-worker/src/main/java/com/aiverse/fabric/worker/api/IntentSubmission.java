package com.aiverse.fabric.worker.api;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.TenantContext;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Body of an intent submission. {@code traceId} may be null; one is generated then. */
public record IntentSubmission(
        @JsonProperty("domain") String domain,
        @JsonProperty("intent") String intent,
        @JsonProperty("inputs") Map<String, Object> inputs,
        @JsonProperty("tenant_context") TenantContext tenantContext,
        @JsonProperty("trace_id") String traceId) {

    public IntentSubmission {
        inputs = Copies.map(inputs);
    }
}
