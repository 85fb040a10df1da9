package com.acme.reconcile.exception;

/**
 * Thrown when a required model artifact or dataset is missing or unreadable.
 * Fatal: raised before any scoring happens.
 */
public class ConfigurationException extends ReconciliationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
