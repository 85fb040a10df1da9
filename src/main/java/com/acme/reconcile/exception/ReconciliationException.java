package com.acme.reconcile.exception;

/**
 * Base type for all reconciliation failures.
 * Unchecked so that pipeline stages stay free of throws clauses.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
