package com.aiverse.fabric.signals;

import java.util.List;

/**
 * Publishes to several spines in order. Accepted only if every delegate accepts; the first exception propagates
 * after the remaining delegates have been tried.
 */
public final class CompositeSpine implements ObservabilitySpine {

    private final List<ObservabilitySpine> delegates;

    public CompositeSpine(List<ObservabilitySpine> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean publish(FeedbackSignal signal) {
        boolean accepted = true;
        RuntimeException first = null;
        for (ObservabilitySpine d : delegates) {
            try {
                accepted &= d.publish(signal);
            } catch (RuntimeException e) {
                if (first == null) first = e;
            }
        }
        if (first != null) throw first;
        return accepted;
    }
}
