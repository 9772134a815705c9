package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ConflictException;
import com.bookati.common.exception.ForbiddenException;
import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.reservation.api.dto.BookingResponse;
import com.bookati.reservation.api.dto.RescheduleResponse;
import com.bookati.reservation.domain.model.Booking;
import com.bookati.reservation.domain.model.BookingAuditLog.AuditAction;
import com.bookati.reservation.domain.model.Slot;
import com.bookati.reservation.domain.repository.BookingRepository;
import com.bookati.reservation.events.BookingEventPublisher;
import com.bookati.reservation.events.TicketRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Moves a booking to another slot of the same service.
 *
 * The new slot is reserved before the old one is released, both in one transaction: if the
 * new slot is full nothing has been given back yet, and the rollback leaves both slots as they were.
 * The ticket token is replaced so the old ticket can not be checked in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RescheduleService {

    private final BookingRepository bookingRepository;
    private final SlotCapacityService slotCapacityService;
    private final ReservationLockService lockService;
    private final CatalogLookupService catalog;
    private final BookingEventPublisher eventPublisher;
    private final BookingAuditService auditService;
    private final Clock clock;

    @Retryable(retryFor = PessimisticLockingFailureException.class,
            maxAttempts = 3, backoff = @Backoff(delay = 100, multiplier = 2))
    @Transactional(timeoutString = "${reservation.booking.transaction-timeout-seconds:10}")
    public RescheduleResponse moveBooking(UUID tenantId, UUID bookingId, UUID newSlotId) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        if (!booking.getTenantId().equals(tenantId)) {
            throw new ForbiddenException("Booking " + bookingId + " belongs to another tenant", "TENANT_MISMATCH");
        }
        if (!booking.holdsCapacity()) {
            throw new ConflictException("A " + booking.getStatus() + " booking can not be rescheduled",
                    "INVALID_STATUS_TRANSITION");
        }

        UUID oldSlotId = booking.getSlotId();
        if (oldSlotId.equals(newSlotId)) {
            log.debug("Booking {} already on slot {}, nothing to move", bookingId, newSlotId);
            return new RescheduleResponse(BookingResponse.from(booking), oldSlotId, false);
        }

        Slot newSlot = slotCapacityService.verifyBookable(newSlotId, tenantId, booking.getServiceId());
        int quantity = booking.getVisitorCount();

        slotCapacityService.reserve(newSlotId, quantity, lockService.heldCapacity(newSlotId, null));
        slotCapacityService.release(oldSlotId, quantity);

        BigDecimal previousTotal = booking.getTotalPrice();
        BigDecimal newTotal = recomputeTotal(booking);
        boolean priceChanged = newTotal.compareTo(previousTotal) != 0;

        booking.setSlotId(newSlotId);
        booking.setEmployeeId(newSlot.getEmployeeId());
        booking.setTicketToken(BookingTransactionEngine.newTicketToken());
        booking.setQrScanned(false);
        booking.setTotalPrice(newTotal);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        booking = bookingRepository.save(booking);
        auditService.record(booking, AuditAction.RESCHEDULED, slotAndPrice(oldSlotId, previousTotal),
                slotAndPrice(newSlotId, newTotal));

        if (priceChanged) {
            eventPublisher.publishInvoiceAmountChanged(booking, previousTotal);
        }
        eventPublisher.publishTicketRequested(booking, TicketRequestedEvent.TicketAction.RESCHEDULED);

        log.info("Booking {} moved from slot {} to slot {}{}", bookingId, oldSlotId, newSlotId,
                priceChanged ? " (price " + previousTotal + " -> " + newTotal + ")" : "");
        return new RescheduleResponse(BookingResponse.from(booking), oldSlotId, priceChanged);
    }

    private static Map<String, Object> slotAndPrice(UUID slotId, BigDecimal totalPrice) {
        Map<String, Object> values = BookingAuditService.values("slotId", slotId);
        values.put("totalPrice", totalPrice);
        return values;
    }

    /**
     * Paid visitors at today's unit price. Keeps the stored total when the price is no longer
     * set, since a booking that owes money is never free.
     */
    private BigDecimal recomputeTotal(Booking booking) {
        if (booking.getPaidQuantity() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal unitPrice = catalog.currentUnitPrice(booking.getServiceId(), booking.getOfferId());
        if (unitPrice.signum() <= 0) {
            log.warn("Service {} has no price, keeping total {} on booking {}",
                    booking.getServiceId(), booking.getTotalPrice(), booking.getId());
            return booking.getTotalPrice();
        }
        return unitPrice.multiply(BigDecimal.valueOf(booking.getPaidQuantity()));
    }
}
