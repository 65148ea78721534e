package com.paramvault.api.exception;

import lombok.Getter;

/**
 * Base class for failures talking to the credential generator process.
 * Carries whatever the process wrote to its error stream before failing.
 */
@Getter
public abstract class GeneratorException extends RuntimeException {

    private final String stderr;

    protected GeneratorException(String message, String stderr, Throwable cause) {
        super(stderr == null || stderr.isBlank() ? message : message + " (stderr: " + stderr.strip() + ")", cause);
        this.stderr = stderr == null ? "" : stderr;
    }
}
