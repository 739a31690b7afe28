package com.aiverse.fabric.unit;

import java.util.Objects;

/**
 * Failure raised by a port (registry, storage, engine). The {@link PortFailure} kind tells the unit which
 * of its declared failure modes occurred; the message is carried into the unit's error message.
 */
public class PortException extends Exception {

    private final PortFailure failure;
    private final String subject;

    public PortException(PortFailure failure, String message) {
        this(failure, message, (String) null);
    }

    /**
     * @param subject what the failure concerns, e.g. the environment id of an unreachable location; may be null
     */
    public PortException(PortFailure failure, String message, String subject) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.subject = subject;
    }

    public PortException(PortFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.subject = null;
    }

    public PortFailure failure() {
        return failure;
    }

    public String subject() {
        return subject;
    }
}
