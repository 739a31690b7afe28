package com.aiverse.fabric.unit;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Port implementations keyed by port interface. Filled by {@link PortProvider}s at bootstrap and read when
 * units are created. A later binding for the same interface replaces the earlier one.
 */
public final class PortBindings {

    private final Map<Class<?>, Object> ports = new ConcurrentHashMap<>();

    /**
     * Binds {@code impl} as the implementation of {@code type}.
     *
     * @return the previous binding, or null
     */
    public <T> T bind(Class<T> type, T impl) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(impl, "impl");
        return type.cast(ports.put(type, impl));
    }

    public <T> Optional<T> find(Class<T> type) {
        return Optional.ofNullable(type.cast(ports.get(type)));
    }

    /**
     * @throws IllegalStateException if nothing is bound for {@code type}
     */
    public <T> T require(Class<T> type) {
        Object impl = ports.get(type);
        if (impl == null) {
            throw new IllegalStateException("No port bound for " + type.getSimpleName());
        }
        return type.cast(impl);
    }

    public boolean has(Class<?> type) {
        return ports.containsKey(type);
    }

    public boolean hasAll(Collection<Class<?>> types) {
        for (Class<?> t : types) {
            if (!ports.containsKey(t)) return false;
        }
        return true;
    }

    public Set<Class<?>> boundTypes() {
        return Collections.unmodifiableSet(ports.keySet());
    }

    public void clear() {
        ports.clear();
    }
}
