package com.aiverse.fabric.signals;

/**
 * Port to the platform's observability spine. Implementations deliver signals to metrics backends,
 * subscribers or remote collectors.
 */
public interface ObservabilitySpine {

    /**
     * Publishes a signal.
     *
     * @return true if accepted
     * @throws RuntimeException on delivery failure; the emitter records it as a failed emission
     */
    boolean publish(FeedbackSignal signal);
}
