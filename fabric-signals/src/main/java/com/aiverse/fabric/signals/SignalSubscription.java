package com.aiverse.fabric.signals;

import java.util.UUID;

/**
 * Handle returned by {@link SignalBus#subscribe}. Closing it unsubscribes.
 */
public final class SignalSubscription implements AutoCloseable {

    private final UUID id;
    private final SignalFilter filter;
    private final SignalBus bus;

    SignalSubscription(UUID id, SignalFilter filter, SignalBus bus) {
        this.id = id;
        this.filter = filter;
        this.bus = bus;
    }

    public UUID getId() {
        return id;
    }

    public SignalFilter getFilter() {
        return filter;
    }

    public boolean isActive() {
        return bus.isSubscribed(id);
    }

    @Override
    public void close() {
        bus.unsubscribe(id);
    }
}
