package com.bookati.reservation.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record AcquireLockRequest(
        @NotNull(message = "Slot ID cannot be null")
        UUID slotId,

        @Size(max = 128)
        String sessionId,

        @NotNull(message = "Reserved capacity cannot be null")
        @Positive(message = "Reserved capacity must be at least 1")
        Integer reservedCapacity,

        @Positive(message = "TTL must be positive")
        Integer ttlSeconds
) {
}
