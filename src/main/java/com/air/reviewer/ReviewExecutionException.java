package com.air.reviewer;

/**
 * The reviewer could not be run, or exited unsuccessfully.
 */
public class ReviewExecutionException extends ReviewFailureException {

    public ReviewExecutionException(String message) {
        super(message);
    }

    public ReviewExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
