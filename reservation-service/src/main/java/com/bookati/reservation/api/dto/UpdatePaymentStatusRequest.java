package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.model.Booking;
import jakarta.validation.constraints.NotNull;

public record UpdatePaymentStatusRequest(
        @NotNull(message = "Payment status cannot be null")
        Booking.PaymentStatus paymentStatus
) {
}
