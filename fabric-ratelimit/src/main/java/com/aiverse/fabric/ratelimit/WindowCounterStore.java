package com.aiverse.fabric.ratelimit;

/**
 * Counter storage for rate-limit windows. Keys are unique per tenant, class and minute.
 */
public interface WindowCounterStore extends AutoCloseable {

    /**
     * Increments the counter for the key and returns the new value. A new counter expires after
     * {@code ttlSeconds}.
     */
    long increment(String key, int ttlSeconds);

    /** Current value, 0 when missing or expired. */
    long get(String key);

    /** Releases connections held by the store. No-op by default. */
    @Override
    default void close() {
    }
}
