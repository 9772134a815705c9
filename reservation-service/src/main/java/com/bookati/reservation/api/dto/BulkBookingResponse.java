package com.bookati.reservation.api.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record BulkBookingResponse(
        UUID bookingGroupId,
        List<BookingResponse> bookings,
        int totalBookings,
        int packageCoveredTotal,
        int paidTotal,
        BigDecimal totalPrice
) {
    public static BulkBookingResponse from(UUID bookingGroupId, List<BookingResponse> bookings) {
        int covered = 0;
        int paid = 0;
        BigDecimal total = BigDecimal.ZERO;
        for (BookingResponse booking : bookings) {
            covered += booking.packageCoveredQuantity();
            paid += booking.paidQuantity();
            total = total.add(booking.totalPrice());
        }
        return new BulkBookingResponse(bookingGroupId, bookings, bookings.size(), covered, paid, total);
    }
}
