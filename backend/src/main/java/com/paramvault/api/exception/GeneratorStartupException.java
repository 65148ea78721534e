package com.paramvault.api.exception;

/**
 * The generator process could not be spawned or did not announce readiness.
 */
public class GeneratorStartupException extends GeneratorException {

    public GeneratorStartupException(String message, String stderr) {
        super(message, stderr, null);
    }

    public GeneratorStartupException(String message, String stderr, Throwable cause) {
        super(message, stderr, cause);
    }
}
