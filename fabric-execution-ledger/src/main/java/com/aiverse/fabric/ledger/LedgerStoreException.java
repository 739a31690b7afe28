package com.aiverse.fabric.ledger;

/** Raised by an {@link ExecutionStore} when the backing store rejects a read or write. */
public class LedgerStoreException extends RuntimeException {

    public LedgerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
