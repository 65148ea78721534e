package com.paramvault.api.exception;

/**
 * Broken pipe, closed stream, timeout or unparsable output on an established generator channel.
 */
public class GeneratorIpcException extends GeneratorException {

    public GeneratorIpcException(String message, String stderr) {
        super(message, stderr, null);
    }

    public GeneratorIpcException(String message, String stderr, Throwable cause) {
        super(message, stderr, cause);
    }
}
