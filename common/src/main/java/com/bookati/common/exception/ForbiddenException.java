package com.bookati.common.exception;

/**
 * Cross-tenant reference or an operation the current state forbids outright.
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException(String message) {
        super(message, "FORBIDDEN");
    }

    public ForbiddenException(String message, String errorCode) {
        super(message, errorCode);
    }
}
