package com.air.core.store;

/**
 * A durable write could not be completed. Losing an acknowledged result is
 * worse than stopping, so callers treat this as process-fatal.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
