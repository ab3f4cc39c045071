package com.trendearly.pipeline.exception;

/**
 * Series cannot be scored. The caller skips the keyword.
 */
public class InsufficientDataException extends Exception {

    public InsufficientDataException(String message) {
        super(message);
    }
}
