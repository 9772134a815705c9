package com.bookati.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceAmountChangedEvent {
    private UUID bookingId;
    private UUID tenantId;
    private BigDecimal previousTotal;
    private BigDecimal newTotal;
    private Instant occurredAt;
}
