package com.aiverse.fabric.annotations;

/**
 * When a feature is invoked relative to unit execution.
 */
public enum FeaturePhase {
    /** Before the unit executes. */
    PRE,
    /** After the unit returns without an error code. */
    POST_SUCCESS,
    /** After the unit returns an error code or throws. */
    POST_ERROR,
    /** After the unit executes (success or error). */
    FINALLY,
    /** Before the unit and again after (success or error). */
    PRE_FINALLY
}
