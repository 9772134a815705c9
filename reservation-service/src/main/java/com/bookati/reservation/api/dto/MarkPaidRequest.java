package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.model.Booking;

public record MarkPaidRequest(
        Booking.PaymentMethod paymentMethod
) {
}
