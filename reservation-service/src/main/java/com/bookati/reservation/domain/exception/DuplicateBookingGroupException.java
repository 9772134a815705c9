package com.bookati.reservation.domain.exception;

import com.bookati.common.exception.ConflictException;

import java.util.UUID;

public class DuplicateBookingGroupException extends ConflictException {

    public DuplicateBookingGroupException(UUID bookingGroupId) {
        super("Booking group " + bookingGroupId + " already exists", "DUPLICATE_BOOKING_GROUP");
    }
}
