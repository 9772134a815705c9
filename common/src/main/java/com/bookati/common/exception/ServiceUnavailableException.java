package com.bookati.common.exception;

/**
 * Thrown when the store could not serve the request in time (lock wait exhausted, retries used up).
 * Client should retry the same request later.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
