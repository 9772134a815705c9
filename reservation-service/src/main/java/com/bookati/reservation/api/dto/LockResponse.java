package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.model.ReservationLock;

import java.time.LocalDateTime;
import java.util.UUID;

public record LockResponse(
        UUID lockId,
        String sessionId,
        UUID slotId,
        Integer reservedCapacity,
        LocalDateTime expiresAt
) {
    public static LockResponse from(ReservationLock lock) {
        return new LockResponse(
                lock.getId(),
                lock.getSessionId(),
                lock.getSlotId(),
                lock.getReservedCapacity(),
                lock.getExpiresAt()
        );
    }
}
