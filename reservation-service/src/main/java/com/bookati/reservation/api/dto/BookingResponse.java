package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record BookingResponse(
        UUID id,
        UUID tenantId,
        UUID serviceId,
        UUID slotId,
        UUID employeeId,
        UUID customerId,
        String customerName,
        String customerPhone,
        String customerEmail,
        Integer visitorCount,
        Integer adultCount,
        Integer childCount,
        Integer packageCoveredQuantity,
        Integer paidQuantity,
        BigDecimal totalPrice,
        Booking.BookingStatus status,
        Booking.PaymentStatus paymentStatus,
        Booking.PaymentMethod paymentMethod,
        UUID bookingGroupId,
        UUID packageSubscriptionId,
        UUID offerId,
        String notes,
        String language,
        String ticketToken,
        boolean qrScanned,
        LocalDateTime checkedInAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getTenantId(),
                booking.getServiceId(),
                booking.getSlotId(),
                booking.getEmployeeId(),
                booking.getCustomerId(),
                booking.getCustomerName(),
                booking.getCustomerPhone(),
                booking.getCustomerEmail(),
                booking.getVisitorCount(),
                booking.getAdultCount(),
                booking.getChildCount(),
                booking.getPackageCoveredQuantity(),
                booking.getPaidQuantity(),
                booking.getTotalPrice(),
                booking.getStatus(),
                booking.getPaymentStatus(),
                booking.getPaymentMethod(),
                booking.getBookingGroupId(),
                booking.getPackageSubscriptionId(),
                booking.getOfferId(),
                booking.getNotes(),
                booking.getLanguage(),
                booking.getTicketToken(),
                booking.isQrScanned(),
                booking.getCheckedInAt(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
