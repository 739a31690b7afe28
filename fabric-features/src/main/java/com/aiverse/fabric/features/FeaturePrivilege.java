package com.aiverse.fabric.features;

/**
 * Privilege level of a feature. Determines how the runner treats failures.
 * <p>
 * <b>INTERNAL:</b> shipped with the fabric worker (ledger, rate limiting, signal emission). May block a unit
 * invocation by throwing from its pre hook; the exception propagates and the unit does not run.
 * <p>
 * <b>COMMUNITY:</b> observer only. Reads {@link UnitExecutionContext}, logs, emits metrics. If it throws,
 * the runner logs the failure and the invocation continues.
 */
public enum FeaturePrivilege {

    /** Can block execution and affect failure semantics. */
    INTERNAL,

    /** Observer only; failures are logged and execution continues. */
    COMMUNITY
}
