package com.bookati.reservation.domain.exception;

import com.bookati.common.exception.ConflictException;

/**
 * Reservation lock supplied with a booking is missing, expired, foreign or too small.
 */
public class LockInvalidException extends ConflictException {

    public LockInvalidException(String message) {
        super(message, "LOCK_INVALID");
    }
}
