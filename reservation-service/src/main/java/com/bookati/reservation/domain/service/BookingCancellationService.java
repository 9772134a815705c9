package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ConflictException;
import com.bookati.common.exception.ForbiddenException;
import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.reservation.api.dto.BookingResponse;
import com.bookati.reservation.domain.model.Booking;
import com.bookati.reservation.domain.model.BookingAuditLog.AuditAction;
import com.bookati.reservation.domain.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Cancels and deletes bookings, giving slot capacity and package units back first.
 *
 * A cancelled booking has already returned both, so deleting it later returns nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingCancellationService {

    private final BookingRepository bookingRepository;
    private final SlotCapacityService slotCapacityService;
    private final PackageCapacityResolver packageResolver;
    private final BookingAuditService auditService;
    private final Clock clock;

    @Retryable(retryFor = PessimisticLockingFailureException.class,
            maxAttempts = 3, backoff = @Backoff(delay = 100, multiplier = 2))
    @Transactional(timeoutString = "${reservation.booking.transaction-timeout-seconds:10}")
    public BookingResponse cancel(UUID tenantId, UUID bookingId) {
        Booking booking = loadForUpdate(tenantId, bookingId);
        if (!booking.holdsCapacity()) {
            throw new ConflictException("A " + booking.getStatus() + " booking can not be cancelled",
                    "INVALID_STATUS_TRANSITION");
        }

        Map<String, Object> before = BookingAuditService.values("status", booking.getStatus());
        restitute(booking);
        booking.setStatus(Booking.BookingStatus.CANCELLED);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        booking = bookingRepository.save(booking);
        auditService.record(booking, AuditAction.CANCELLED, before,
                BookingAuditService.values("status", Booking.BookingStatus.CANCELLED));

        log.info("Booking {} cancelled, {} returned to slot {}", bookingId, booking.getVisitorCount(), booking.getSlotId());
        return BookingResponse.from(booking);
    }

    /**
     * Hard delete. Bookings with collected payment are protected unless {@code allowIfPaid} is set.
     *
     * @throws IllegalStateException when the row is still present after the delete
     */
    @Retryable(retryFor = PessimisticLockingFailureException.class,
            maxAttempts = 3, backoff = @Backoff(delay = 100, multiplier = 2))
    @Transactional(timeoutString = "${reservation.booking.transaction-timeout-seconds:10}")
    public void delete(UUID tenantId, UUID bookingId, boolean allowIfPaid) {
        Booking booking = loadForUpdate(tenantId, bookingId);
        if (booking.isPaymentCollected() && !allowIfPaid) {
            throw new ForbiddenException("Booking " + bookingId + " has been paid and can not be deleted",
                    "PAID_BOOKING_PROTECTED");
        }

        boolean restored = booking.getStatus() != Booking.BookingStatus.CANCELLED;
        if (restored) {
            restitute(booking);
        }
        Map<String, Object> after = BookingAuditService.values("deletedAt", LocalDateTime.now(clock));
        after.put("capacityRestored", restored);
        auditService.record(booking, AuditAction.DELETED, BookingAuditService.snapshot(booking), after);

        bookingRepository.deleteById(bookingId);
        bookingRepository.flush();
        if (bookingRepository.existsById(bookingId)) {
            log.error("Booking {} still present after delete", bookingId);
            throw new IllegalStateException("Booking " + bookingId + " could not be deleted");
        }
        log.info("Booking {} deleted (status was {}, payment {})", bookingId, booking.getStatus(), booking.getPaymentStatus());
    }

    private Booking loadForUpdate(UUID tenantId, UUID bookingId) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        if (!booking.getTenantId().equals(tenantId)) {
            throw new ForbiddenException("Booking " + bookingId + " belongs to another tenant", "TENANT_MISMATCH");
        }
        return booking;
    }

    /**
     * Returns slot capacity while the booking still holds it, then package units. Slot before
     * usage row, the same order booking creation locks them in.
     */
    private void restitute(Booking booking) {
        if (booking.holdsCapacity()) {
            slotCapacityService.release(booking.getSlotId(), booking.getVisitorCount());
        }
        if (booking.getPackageSubscriptionId() != null && booking.getPackageCoveredQuantity() > 0) {
            packageResolver.credit(booking.getPackageSubscriptionId(), booking.getServiceId(),
                    booking.getPackageCoveredQuantity());
        }
    }
}
