package com.aiverse.fabric.ratelimit;

/**
 * Thrown when a tenant exceeds its per-minute limit for a request class. Fail fast, no blocking;
 * the window resets at the next minute.
 */
public final class RateLimitExceededException extends RuntimeException {

    private final String tenantId;
    private final RateClass rateClass;
    private final long limit;
    private final long usage;

    public RateLimitExceededException(String tenantId, RateClass rateClass, long limit, long usage) {
        super(String.format("Rate limit exceeded for tenant=%s class=%s: usage=%d limit=%d/min",
                tenantId, rateClass.value(), usage, limit));
        this.tenantId = tenantId;
        this.rateClass = rateClass;
        this.limit = limit;
        this.usage = usage;
    }

    public String getTenantId() {
        return tenantId;
    }

    public RateClass getRateClass() {
        return rateClass;
    }

    public long getLimit() {
        return limit;
    }

    public long getUsage() {
        return usage;
    }
}
