package com.aiverse.fabric.ratelimit;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local window counters. Expired counters are purged on increment.
 */
public final class InMemoryWindowCounterStore implements WindowCounterStore {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWindowCounterStore() {
        this(Clock.systemUTC());
    }

    public InMemoryWindowCounterStore(Clock clock) {
        this.clock = clock;
    }

    private record Counter(AtomicLong value, long expiresAtMillis) { }

    @Override
    public long increment(String key, int ttlSeconds) {
        long now = clock.millis();
        counters.values().removeIf(c -> c.expiresAtMillis() <= now);
        Counter c = counters.computeIfAbsent(key, k -> new Counter(new AtomicLong(), now + ttlSeconds * 1000L));
        return c.value().incrementAndGet();
    }

    @Override
    public long get(String key) {
        Counter c = counters.get(key);
        if (c == null || c.expiresAtMillis() <= clock.millis()) return 0L;
        return c.value().get();
    }

    /** Drops all counters. */
    @Override
    public void close() {
        counters.clear();
    }

    /** Number of live counters. */
    int size() {
        return counters.size();
    }
}
