package com.bookati.reservation.events;

import com.bookati.reservation.domain.model.Booking;
import com.bookati.reservation.domain.model.OutboxEvent;
import com.bookati.reservation.domain.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records collaborator events in the outbox table as part of the booking transaction.
 * Nothing here talks to Kafka: a rolled-back booking leaves no event behind, and a committed
 * booking never waits for ticket or invoice delivery. {@code OutboxPublisher} relays the rows.
 *
 * Event types:
 * - ticket.requested: booking created or rescheduled
 * - invoice.requested: booking owes money
 * - invoice.amount-changed: reschedule changed the price
 * - package.exhausted: a subscription ran out for a service
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    public static final String TYPE_TICKET_REQUESTED = "ticket.requested";
    public static final String TYPE_INVOICE_REQUESTED = "invoice.requested";
    public static final String TYPE_INVOICE_AMOUNT_CHANGED = "invoice.amount-changed";
    public static final String TYPE_PACKAGE_EXHAUSTED = "package.exhausted";

    private static final String AGGREGATE_BOOKING = "BOOKING";
    private static final String AGGREGATE_SUBSCRIPTION = "SUBSCRIPTION";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void publishTicketRequested(Booking booking, TicketRequestedEvent.TicketAction action) {
        TicketRequestedEvent event = TicketRequestedEvent.builder()
                .bookingId(booking.getId())
                .tenantId(booking.getTenantId())
                .action(action)
                .ticketToken(booking.getTicketToken())
                .language(booking.getLanguage())
                .occurredAt(Instant.now(clock))
                .build();
        record(AGGREGATE_BOOKING, booking.getId(), TYPE_TICKET_REQUESTED, event);
    }

    /**
     * Records an invoice request when the booking owes money; fully package-covered bookings are skipped.
     *
     * @return whether an event was recorded
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean publishInvoiceRequested(Booking booking, BigDecimal unitPrice) {
        if (booking.getPaidQuantity() <= 0 || booking.getTotalPrice().signum() <= 0) {
            log.debug("Booking {} is fully covered, no invoice requested", booking.getId());
            return false;
        }
        InvoiceRequestedEvent event = InvoiceRequestedEvent.builder()
                .bookingId(booking.getId())
                .tenantId(booking.getTenantId())
                .paidQuantity(booking.getPaidQuantity())
                .unitPrice(unitPrice)
                .totalPrice(booking.getTotalPrice())
                .occurredAt(Instant.now(clock))
                .build();
        record(AGGREGATE_BOOKING, booking.getId(), TYPE_INVOICE_REQUESTED, event);
        return true;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void publishInvoiceAmountChanged(Booking booking, BigDecimal previousTotal) {
        InvoiceAmountChangedEvent event = InvoiceAmountChangedEvent.builder()
                .bookingId(booking.getId())
                .tenantId(booking.getTenantId())
                .previousTotal(previousTotal)
                .newTotal(booking.getTotalPrice())
                .occurredAt(Instant.now(clock))
                .build();
        record(AGGREGATE_BOOKING, booking.getId(), TYPE_INVOICE_AMOUNT_CHANGED, event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void publishPackageExhausted(UUID subscriptionId, UUID serviceId, UUID customerId) {
        PackageExhaustedEvent event = PackageExhaustedEvent.builder()
                .subscriptionId(subscriptionId)
                .serviceId(serviceId)
                .customerId(customerId)
                .occurredAt(Instant.now(clock))
                .build();
        record(AGGREGATE_SUBSCRIPTION, subscriptionId, TYPE_PACKAGE_EXHAUSTED, event);
    }

    private void record(String aggregateType, UUID aggregateId, String type, Object event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event for {} {}", type, aggregateType, aggregateId, e);
            throw new IllegalStateException("Failed to serialize outbox event " + type, e);
        }

        outboxEventRepository.save(OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(aggregateId.toString())
                .type(type)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .processed(false)
                .attempts(0)
                .build());
        log.debug("Recorded outbox event {} for {} {}", type, aggregateType, aggregateId);
    }
}
