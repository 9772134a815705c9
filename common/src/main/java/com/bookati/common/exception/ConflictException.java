package com.bookati.common.exception;

/**
 * The request was well-formed but clashes with current state: no capacity left,
 * a stale reservation lock, a duplicate booking group, an illegal transition.
 * Clients usually react by letting the user pick something else.
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }
}
