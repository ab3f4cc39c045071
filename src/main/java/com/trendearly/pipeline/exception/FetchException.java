package com.trendearly.pipeline.exception;

/**
 * Weekly series could not be obtained, neither from the external service nor from the cache.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
