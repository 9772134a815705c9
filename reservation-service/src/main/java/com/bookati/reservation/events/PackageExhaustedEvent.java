package com.bookati.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A subscription has nothing left for a service. Consumed by the customer notification side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageExhaustedEvent {
    private UUID subscriptionId;
    private UUID serviceId;
    private UUID customerId;
    private Instant occurredAt;
}
