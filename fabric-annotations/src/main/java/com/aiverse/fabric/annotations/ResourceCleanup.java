package com.aiverse.fabric.annotations;

/**
 * Contract for components that hold resources (connections, pools, registries) and must release
 * them when the worker shuts down. The worker calls {@link #onExit()} on registered units, features
 * and stores before the process exits.
 */
public interface ResourceCleanup {

    /**
     * Called once at shutdown. Exceptions should be logged, not rethrown, so other components
     * still get a chance to clean up.
     */
    void onExit();
}
