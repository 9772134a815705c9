package com.bookati.reservation.domain.exception;

import com.bookati.common.exception.ConflictException;

import java.util.UUID;

public class SlotUnavailableException extends ConflictException {

    public SlotUnavailableException(UUID slotId) {
        super("Slot " + slotId + " is not available for booking", "SLOT_UNAVAILABLE");
    }
}
