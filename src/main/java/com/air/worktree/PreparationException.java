package com.air.worktree;

/**
 * Preparing a work tree for a review failed. Fatal to the one review.
 */
public class PreparationException extends Exception {

    public PreparationException(String message) {
        super(message);
    }

    public PreparationException(String message, Throwable cause) {
        super(message, cause);
    }
}
