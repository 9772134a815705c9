package com.bookati.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Asks the ticket collaborator to render and deliver a ticket for the booking.
 * After a reschedule the previous ticket token is void; the new one travels here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketRequestedEvent {
    private UUID bookingId;
    private UUID tenantId;
    private TicketAction action;
    private String ticketToken;
    private String language;
    private Instant occurredAt;

    public enum TicketAction {
        CREATED,
        RESCHEDULED
    }
}
