package com.paramvault.api.exception;

/**
 * Raised when neither a fresh nor a cooled-down credential is available.
 * Handled inside the pool manager by an emergency refill.
 */
public class PoolExhaustedException extends RuntimeException {

    public PoolExhaustedException(String message) {
        super(message);
    }
}
