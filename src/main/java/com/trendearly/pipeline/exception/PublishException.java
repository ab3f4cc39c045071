package com.trendearly.pipeline.exception;

/**
 * The staged page tree could not be swapped in. Snapshots written earlier in the run stay valid.
 */
public class PublishException extends Exception {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
