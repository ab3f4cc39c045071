package com.trendearly.pipeline.exception;

/**
 * Fatal for the whole run: keyword source unreachable, store unreachable, staging I/O failure.
 */
public class InfrastructureException extends RuntimeException {

    public InfrastructureException(String message) {
        super(message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
