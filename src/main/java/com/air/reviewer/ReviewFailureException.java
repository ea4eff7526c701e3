package com.air.reviewer;

/**
 * A reviewer attempt failed. Retried by the reviewer worker up to the configured bound.
 */
public abstract class ReviewFailureException extends Exception {

    protected ReviewFailureException(String message) {
        super(message);
    }

    protected ReviewFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
