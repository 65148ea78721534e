package com.paramvault.api.exception;

/**
 * The pool stayed empty even after a synchronous generator request.
 */
public class RefillFailedException extends RuntimeException {

    public RefillFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
