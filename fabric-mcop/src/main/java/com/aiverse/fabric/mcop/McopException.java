package com.aiverse.fabric.mcop;

/**
 * Failure reported by an MCOP control-plane port (intent engine, scheduler, asset registry).
 */
public class McopException extends Exception {

    public McopException(String message) {
        super(message);
    }

    public McopException(String message, Throwable cause) {
        super(message, cause);
    }
}
