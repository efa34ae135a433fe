package com.casebattle.ledger.exception;

/**
 * Durable read or write failure. The operation in progress is aborted and the ledger
 * stays at its last committed state.
 */
public class LedgerStorageException extends RuntimeException {

    public LedgerStorageException(String message) {
        super(message);
    }

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
