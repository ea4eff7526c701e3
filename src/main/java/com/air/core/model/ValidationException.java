package com.air.core.model;

/**
 * Thrown when a review submission is malformed. Raised while the request is
 * being constructed, so an invalid request never reaches the queue.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
