package com.bookati.reservation.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record RescheduleRequest(
        @NotNull(message = "New slot ID cannot be null")
        UUID newSlotId
) {
}
