package com.aiverse.fabric.unit;

/**
 * Kind of failure reported by a port. Each unit maps the kinds it declares to its own error codes;
 * anything else propagates to the invoker.
 */
public enum PortFailure {
    /** Backing service cannot be reached at all. */
    UNAVAILABLE,
    NOT_FOUND,
    ACCESS_DENIED,
    /** Target already exists. */
    CONFLICT,
    TIMEOUT,
    NETWORK,
    AUTHENTICATION,
    READ_FAILURE,
    WRITE_FAILURE,
    /** Payload could not be decoded or encoded in the requested format. */
    FORMAT,
    SCHEMA_MISMATCH,
    QUOTA_EXCEEDED,
    /** Referenced definition (rules, aggregation, dataset) is malformed. */
    INVALID,
    KEY_MISMATCH,
    RESOURCE_EXHAUSTED,
    MEMORY_EXHAUSTED,
    /** Engine failed while computing. */
    COMPUTATION,
    /** One location or environment could not be probed; {@link PortException#subject()} names it. */
    UNREACHABLE
}
