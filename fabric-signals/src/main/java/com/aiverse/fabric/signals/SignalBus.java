package com.aiverse.fabric.signals;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-process fan-out of published signals to filtered subscribers. A subscriber that throws is logged and
 * does not affect other subscribers or the publisher.
 */
public final class SignalBus implements ObservabilitySpine {

    private static final Logger log = LoggerFactory.getLogger(SignalBus.class);

    private record Subscriber(SignalFilter filter, Consumer<FeedbackSignal> listener) { }

    private final Map<UUID, Subscriber> subscribers = new ConcurrentHashMap<>();

    public SignalSubscription subscribe(SignalFilter filter, Consumer<FeedbackSignal> listener) {
        Objects.requireNonNull(listener, "listener");
        SignalFilter f = filter != null ? filter : SignalFilter.all();
        UUID id = UUID.randomUUID();
        subscribers.put(id, new Subscriber(f, listener));
        log.debug("Signal subscription {} added (domain={}, types={}, tenants={})",
                id, f.domain(), f.signalTypes(), f.tenantFilter());
        return new SignalSubscription(id, f, this);
    }

    /** Returns true if the subscription existed. */
    public boolean unsubscribe(UUID subscriptionId) {
        return subscriptionId != null && subscribers.remove(subscriptionId) != null;
    }

    boolean isSubscribed(UUID subscriptionId) {
        return subscribers.containsKey(subscriptionId);
    }

    public int getSubscriptionCount() {
        return subscribers.size();
    }

    @Override
    public boolean publish(FeedbackSignal signal) {
        for (Map.Entry<UUID, Subscriber> e : subscribers.entrySet()) {
            Subscriber s = e.getValue();
            if (!s.filter().matches(signal)) continue;
            try {
                s.listener().accept(signal);
            } catch (RuntimeException ex) {
                log.warn("Signal subscriber {} failed on {}", e.getKey(), signal.name(), ex);
            }
        }
        return true;
    }

    public void clear() {
        subscribers.clear();
    }
}
