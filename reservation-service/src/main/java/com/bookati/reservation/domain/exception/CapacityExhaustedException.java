package com.bookati.reservation.domain.exception;

import com.bookati.common.exception.ConflictException;
import lombok.Getter;

import java.util.UUID;

/**
 * Slot does not have enough effective capacity for the request.
 */
@Getter
public class CapacityExhaustedException extends ConflictException {

    private final UUID slotId;
    private final int available;
    private final int requested;

    public CapacityExhaustedException(UUID slotId, int available, int requested) {
        super(String.format("Not enough capacity available on slot %s. Only %d available, but %d requested.",
                slotId, Math.max(available, 0), requested), "CAPACITY_EXHAUSTED");
        this.slotId = slotId;
        this.available = Math.max(available, 0);
        this.requested = requested;
    }

    public CapacityExhaustedException(String message) {
        super(message, "CAPACITY_EXHAUSTED");
        this.slotId = null;
        this.available = 0;
        this.requested = 0;
    }
}
