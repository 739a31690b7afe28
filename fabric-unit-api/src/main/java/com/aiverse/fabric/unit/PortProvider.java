package com.aiverse.fabric.unit;

/**
 * SPI for port adapters (registry clients, storage, engines). Implementations are discovered via
 * {@link java.util.ServiceLoader} ({@code META-INF/services/com.aiverse.fabric.unit.PortProvider}) on the
 * worker classpath and in adapter JARs loaded by {@link AdapterManager}.
 */
public interface PortProvider {

    /** Name for logs, e.g. {@code s3-staging}. */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Whether this provider should bind anything. Override to skip when its environment is unset.
     */
    default boolean isEnabled() {
        return true;
    }

    /** Binds this provider's port implementations. */
    void bind(PortBindings bindings);
}
