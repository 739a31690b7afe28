package com.aiverse.fabric.ratelimit;

import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.Objects;

/**
 * Redis-backed window counters shared across workers: INCR, then EXPIRE when the key was just created.
 */
public final class RedisWindowCounterStore implements WindowCounterStore {

    private final JedisPool pool;

    public RedisWindowCounterStore(String host, int port) {
        this(host, port, new JedisPoolConfig());
    }

    public RedisWindowCounterStore(String host, int port, JedisPoolConfig poolConfig) {
        Objects.requireNonNull(host, "host");
        this.pool = new JedisPool(poolConfig, host, port);
    }

    @Override
    public long increment(String key, int ttlSeconds) {
        try (var jedis = pool.getResource()) {
            long value = jedis.incr(key);
            if (value == 1L) {
                jedis.expire(key, ttlSeconds);
            }
            return value;
        }
    }

    @Override
    public long get(String key) {
        try (var jedis = pool.getResource()) {
            String v = jedis.get(key);
            if (v == null || v.isBlank()) return 0L;
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
