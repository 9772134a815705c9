package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.model.Booking;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

/**
 * One visitor per entry of {@code slotIds}; a slot may repeat. All rows commit together or not at all.
 */
public record CreateBulkBookingRequest(
        @NotNull(message = "Tenant ID cannot be null")
        UUID tenantId,

        @NotNull(message = "Service ID cannot be null")
        UUID serviceId,

        @NotEmpty(message = "At least one slot is required")
        List<@NotNull UUID> slotIds,

        @NotBlank(message = "Customer name is required")
        @Size(max = 200)
        String customerName,

        @NotBlank(message = "Customer phone is required")
        String customerPhone,

        @Email(message = "Customer email is not valid")
        String customerEmail,

        UUID customerId,

        @NotNull(message = "Visitor count cannot be null")
        @Positive(message = "Visitor count must be at least 1")
        Integer visitorCount,

        @Min(0)
        Integer adultCount,

        @Min(0)
        Integer childCount,

        UUID bookingGroupId,

        UUID offerId,

        @Size(max = 2000)
        String notes,

        @Pattern(regexp = "en|ar", message = "Language must be en or ar")
        String language,

        Booking.PaymentMethod paymentMethod
) {
}
