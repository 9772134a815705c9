package com.bookati.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted only for bookings that owe money: paid quantity and total price both above zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceRequestedEvent {
    private UUID bookingId;
    private UUID tenantId;
    private int paidQuantity;
    private BigDecimal unitPrice;
    private BigDecimal totalPrice;
    private Instant occurredAt;
}
