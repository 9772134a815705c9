package com.bookati.reservation.api.dto;

import java.util.UUID;

public record RescheduleResponse(
        BookingResponse booking,
        UUID oldSlotId,
        boolean priceChanged
) {
}
