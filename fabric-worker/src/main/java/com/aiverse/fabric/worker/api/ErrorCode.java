package com.aiverse.fabric.worker.api;

/** Error codes of the external API. Rendered by name. */
public enum ErrorCode {
    DATA_NOT_FOUND,
    ACCESS_DENIED,
    VALIDATION_FAILED,
    EXECUTION_FAILED,
    TIMEOUT,
    RATE_LIMITED
}
