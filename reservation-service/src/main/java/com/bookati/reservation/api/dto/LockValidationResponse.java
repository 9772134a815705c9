package com.bookati.reservation.api.dto;

import java.time.LocalDateTime;

public record LockValidationResponse(
        boolean valid,
        long secondsRemaining,
        LocalDateTime expiresAt
) {
    public static LockValidationResponse invalid() {
        return new LockValidationResponse(false, 0, null);
    }
}
