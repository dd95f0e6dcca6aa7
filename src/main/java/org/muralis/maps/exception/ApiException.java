package org.muralis.maps.exception;

/**
 * Base type for failures reported by the mapping provider or the transport in front of it.
 */
public abstract class ApiException extends RuntimeException {

    protected ApiException(String message) {
        super(message);
    }

    protected ApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
