package com.aiverse.fabric.ratelimit;

import com.aiverse.fabric.config.FabricConfig;
import com.aiverse.fabric.config.TenantConfigRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Clock;
import java.util.Objects;

/**
 * Per-tenant fixed-window rate limiter. Each tenant has one counter per {@link RateClass} per UTC minute, keyed
 * {@code <tenant>:fabric:ratelimit:<class>:<epochMinute>}. Limits come from {@link FabricConfig}
 * (FABRIC_RATE_LIMIT_*) and may be overridden per tenant with the {@code rateLimits} section of the tenant config,
 * e.g. {@code {"rateLimits": {"write": 20}}}. A limit of 0 or less disables the check for that class.
 * <p>
 * If the counter store is unreachable the request is allowed and a warning is logged.
 */
public final class RateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final String TENANT_SECTION = "rateLimits";
    private static final int WINDOW_SECONDS = 60;

    private final FabricConfig config;
    private final TenantConfigRegistry tenantConfigs;
    private final WindowCounterStore store;
    private final Clock clock;

    public RateLimiter(FabricConfig config, TenantConfigRegistry tenantConfigs, WindowCounterStore store, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.tenantConfigs = Objects.requireNonNull(tenantConfigs, "tenantConfigs");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Builds a limiter over the store selected by FABRIC_RATE_LIMIT_STORE. */
    public static RateLimiter create(FabricConfig config) {
        return create(config, TenantConfigRegistry.getInstance());
    }

    public static RateLimiter create(FabricConfig config, TenantConfigRegistry tenantConfigs) {
        WindowCounterStore store = config.getRateLimitStore() == FabricConfig.CounterStore.REDIS
                ? new RedisWindowCounterStore(config.getRedisHost(), config.getRedisPort())
                : new InMemoryWindowCounterStore();
        log.info("Rate limiter using {} store (read={}, write={}, compute={} per minute)",
                config.getRateLimitStore(), config.getReadLimitPerMinute(),
                config.getWriteLimitPerMinute(), config.getComputeLimitPerMinute());
        return new RateLimiter(config, tenantConfigs, store, Clock.systemUTC());
    }

    /**
     * Counts one request against the tenant's current window.
     *
     * @return usage in the current window, including this request
     * @throws RateLimitExceededException when the usage exceeds the limit
     */
    public long acquire(String tenantId, RateClass rateClass) {
        Objects.requireNonNull(rateClass, "rateClass");
        String tenant = FabricConfig.normalizeTenantId(tenantId);
        int limit = limitFor(tenant, rateClass);
        if (limit <= 0) {
            return 0L;
        }
        long usage;
        try {
            usage = store.increment(windowKey(tenant, rateClass), WINDOW_SECONDS);
        } catch (JedisException e) {
            log.warn("Rate limit store unavailable; allowing request tenant={} class={}", tenant, rateClass.value(), e);
            return 0L;
        }
        if (usage > limit) {
            log.warn("Rate limit exceeded: tenant={} class={} usage={} limit={}", tenant, rateClass.value(), usage, limit);
            throw new RateLimitExceededException(tenant, rateClass, limit, usage);
        }
        return usage;
    }

    /** Usage in the current window without counting a request. */
    public long currentUsage(String tenantId, RateClass rateClass) {
        return store.get(windowKey(FabricConfig.normalizeTenantId(tenantId), rateClass));
    }

    /** Effective per-minute limit for the tenant and class. */
    public int limitFor(String tenantId, RateClass rateClass) {
        int configured = switch (rateClass) {
            case READ -> config.getReadLimitPerMinute();
            case WRITE -> config.getWriteLimitPerMinute();
            case COMPUTE -> config.getComputeLimitPerMinute();
        };
        return tenantConfigs.get(tenantId).getNestedInt(TENANT_SECTION, rateClass.value(), configured);
    }

    String windowKey(String tenant, RateClass rateClass) {
        long epochMinute = clock.millis() / 60_000L;
        return config.getRateLimitKeyPrefix(tenant) + ":" + rateClass.value() + ":" + epochMinute;
    }

    /** Releases the counter store (the Redis pool for the shared store). */
    @Override
    public void close() {
        store.close();
        log.debug("Rate limiter store closed");
    }
}
