package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.model.Booking;
import jakarta.validation.constraints.NotNull;

public record UpdateStatusRequest(
        @NotNull(message = "Status cannot be null")
        Booking.BookingStatus status
) {
}
