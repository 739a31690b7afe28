package com.aiverse.fabric.signals;

import com.aiverse.fabric.contracts.TenantContext;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Subscription filter {@code {domain, signal_types, tenant_filter}}. Empty or null parts match everything.
 * A tenant filter entry matches a tenant id ({@code org/ws}) or a bare organization id.
 */
public record SignalFilter(
        @JsonProperty("domain") String domain,
        @JsonProperty("signal_types") Set<String> signalTypes,
        @JsonProperty("tenant_filter") Set<String> tenantFilter) {

    public SignalFilter {
        signalTypes = signalTypes != null ? Set.copyOf(signalTypes) : Set.of();
        tenantFilter = tenantFilter != null ? Set.copyOf(tenantFilter) : Set.of();
    }

    public static SignalFilter all() {
        return new SignalFilter(null, null, null);
    }

    public boolean matches(FeedbackSignal signal) {
        if (domain != null && !domain.isBlank() && !sameDomain(domain, signal.domain())) return false;
        if (!signalTypes.isEmpty() && !signalTypes.contains(signal.signalType().value())) return false;
        if (tenantFilter.isEmpty()) return true;
        TenantContext t = signal.tenant();
        if (t == null) return false;
        return tenantFilter.contains(t.tenantId()) || tenantFilter.contains(t.organizationId().toString());
    }

    /** data_fabric and data-fabric name the same domain. */
    static boolean sameDomain(String a, String b) {
        return b != null && a.trim().replace('_', '-').equalsIgnoreCase(b.trim().replace('_', '-'));
    }
}
