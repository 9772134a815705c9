package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ConflictException;
import com.bookati.common.exception.ForbiddenException;
import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.reservation.api.dto.BookingResponse;
import com.bookati.reservation.domain.model.Booking;
import com.bookati.reservation.domain.model.BookingAuditLog.AuditAction;
import com.bookati.reservation.domain.model.Booking.BookingStatus;
import com.bookati.reservation.domain.model.Booking.PaymentStatus;
import com.bookati.reservation.domain.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reads and lifecycle transitions of existing bookings. Cancellation goes through
 * {@link BookingCancellationService} so capacity and package units are returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final Map<BookingStatus, Set<BookingStatus>> STATUS_TRANSITIONS = new EnumMap<>(BookingStatus.class);
    private static final Map<PaymentStatus, Set<PaymentStatus>> PAYMENT_TRANSITIONS = new EnumMap<>(PaymentStatus.class);

    static {
        STATUS_TRANSITIONS.put(BookingStatus.PENDING, EnumSet.of(BookingStatus.CONFIRMED, BookingStatus.CANCELLED));
        STATUS_TRANSITIONS.put(BookingStatus.CONFIRMED,
                EnumSet.of(BookingStatus.CHECKED_IN, BookingStatus.COMPLETED, BookingStatus.CANCELLED));
        STATUS_TRANSITIONS.put(BookingStatus.CHECKED_IN, EnumSet.of(BookingStatus.COMPLETED));
        STATUS_TRANSITIONS.put(BookingStatus.COMPLETED, EnumSet.noneOf(BookingStatus.class));
        STATUS_TRANSITIONS.put(BookingStatus.CANCELLED, EnumSet.noneOf(BookingStatus.class));

        PAYMENT_TRANSITIONS.put(PaymentStatus.UNPAID, EnumSet.of(
                PaymentStatus.PAID, PaymentStatus.PAID_MANUAL, PaymentStatus.AWAITING_PAYMENT, PaymentStatus.REFUNDED));
        PAYMENT_TRANSITIONS.put(PaymentStatus.AWAITING_PAYMENT, EnumSet.of(
                PaymentStatus.PAID, PaymentStatus.PAID_MANUAL, PaymentStatus.UNPAID, PaymentStatus.REFUNDED));
        PAYMENT_TRANSITIONS.put(PaymentStatus.PAID, EnumSet.of(
                PaymentStatus.REFUNDED, PaymentStatus.UNPAID, PaymentStatus.AWAITING_PAYMENT));
        PAYMENT_TRANSITIONS.put(PaymentStatus.PAID_MANUAL, EnumSet.of(
                PaymentStatus.REFUNDED, PaymentStatus.UNPAID, PaymentStatus.AWAITING_PAYMENT));
        PAYMENT_TRANSITIONS.put(PaymentStatus.REFUNDED, EnumSet.of(
                PaymentStatus.UNPAID, PaymentStatus.AWAITING_PAYMENT));
    }

    private final BookingRepository bookingRepository;
    private final BookingCancellationService cancellationService;
    private final BookingAuditService auditService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public BookingResponse getBooking(UUID tenantId, UUID bookingId) {
        return BookingResponse.from(load(tenantId, bookingId));
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getGroup(UUID tenantId, UUID bookingGroupId) {
        List<Booking> bookings = bookingRepository.findByBookingGroupIdOrderByCreatedAtAsc(bookingGroupId).stream()
                .filter(booking -> booking.getTenantId().equals(tenantId))
                .collect(Collectors.toList());
        if (bookings.isEmpty()) {
            throw new ResourceNotFoundException("Booking group", bookingGroupId);
        }
        return bookings.stream().map(BookingResponse::from).collect(Collectors.toList());
    }

    @Transactional
    public BookingResponse updateStatus(UUID tenantId, UUID bookingId, BookingStatus target) {
        if (target == BookingStatus.CANCELLED) {
            return cancellationService.cancel(tenantId, bookingId);
        }

        Booking booking = loadForUpdate(tenantId, bookingId);
        BookingStatus current = booking.getStatus();
        if (current == target) {
            return BookingResponse.from(booking);
        }
        if (!STATUS_TRANSITIONS.get(current).contains(target)) {
            throw new ConflictException(String.format("Booking %s can not move from %s to %s", bookingId, current, target),
                    "INVALID_STATUS_TRANSITION");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        booking.setStatus(target);
        if (target == BookingStatus.CHECKED_IN && booking.getCheckedInAt() == null) {
            booking.setCheckedInAt(now);
        }
        booking.setUpdatedAt(now);
        auditService.record(booking, AuditAction.STATUS_CHANGED,
                BookingAuditService.values("status", current), BookingAuditService.values("status", target));
        log.info("Booking {} status {} -> {}", bookingId, current, target);
        return BookingResponse.from(bookingRepository.save(booking));
    }

    @Transactional
    public BookingResponse updatePaymentStatus(UUID tenantId, UUID bookingId, PaymentStatus target) {
        Booking booking = loadForUpdate(tenantId, bookingId);
        PaymentStatus current = booking.getPaymentStatus();
        if (current == target) {
            return BookingResponse.from(booking);
        }
        if (!PAYMENT_TRANSITIONS.get(current).contains(target)) {
            throw new ConflictException(String.format("Payment of booking %s can not move from %s to %s",
                    bookingId, current, target), "INVALID_PAYMENT_TRANSITION");
        }

        booking.setPaymentStatus(target);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        auditService.record(booking, AuditAction.PAYMENT_STATUS_CHANGED,
                BookingAuditService.values("paymentStatus", current), BookingAuditService.values("paymentStatus", target));
        log.info("Booking {} payment {} -> {}", bookingId, current, target);
        return BookingResponse.from(bookingRepository.save(booking));
    }

    /**
     * Staff recorded a payment taken outside the gateway.
     */
    @Transactional
    public BookingResponse markPaid(UUID tenantId, UUID bookingId, Booking.PaymentMethod paymentMethod) {
        Booking booking = loadForUpdate(tenantId, bookingId);
        PaymentStatus current = booking.getPaymentStatus();
        if (current != PaymentStatus.UNPAID && current != PaymentStatus.AWAITING_PAYMENT) {
            throw new ConflictException("Booking " + bookingId + " is already " + current, "INVALID_PAYMENT_TRANSITION");
        }

        Map<String, Object> before = BookingAuditService.values("paymentStatus", current);
        before.put("paymentMethod", booking.getPaymentMethod());
        booking.setPaymentStatus(PaymentStatus.PAID_MANUAL);
        if (paymentMethod != null) {
            booking.setPaymentMethod(paymentMethod);
        }
        booking.setUpdatedAt(LocalDateTime.now(clock));
        Map<String, Object> after = BookingAuditService.values("paymentStatus", PaymentStatus.PAID_MANUAL);
        after.put("paymentMethod", booking.getPaymentMethod());
        auditService.record(booking, AuditAction.MARKED_PAID, before, after);
        log.info("Booking {} marked paid ({})", bookingId, paymentMethod);
        return BookingResponse.from(bookingRepository.save(booking));
    }

    /**
     * Scans a ticket. Tokens of another tenant read as unknown.
     */
    @Transactional
    public BookingResponse checkIn(UUID tenantId, String ticketToken) {
        Booking booking = bookingRepository.findByTicketToken(ticketToken)
                .filter(b -> b.getTenantId().equals(tenantId))
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketToken));
        if (booking.isQrScanned()) {
            throw new ConflictException("Ticket of booking " + booking.getId() + " was already scanned at "
                    + booking.getCheckedInAt(), "ALREADY_CHECKED_IN");
        }
        if (!booking.holdsCapacity()) {
            throw new ConflictException("A " + booking.getStatus() + " booking can not be checked in",
                    "INVALID_STATUS_TRANSITION");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Object> before = BookingAuditService.values("status", booking.getStatus());
        booking.setQrScanned(true);
        booking.setStatus(BookingStatus.CHECKED_IN);
        booking.setCheckedInAt(now);
        booking.setUpdatedAt(now);
        Map<String, Object> after = BookingAuditService.values("status", BookingStatus.CHECKED_IN);
        after.put("checkedInAt", now);
        auditService.record(booking, AuditAction.CHECKED_IN, before, after);
        log.info("Booking {} checked in", booking.getId());
        return BookingResponse.from(bookingRepository.save(booking));
    }

    private Booking load(UUID tenantId, UUID bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        return requireTenant(booking, tenantId);
    }

    private Booking loadForUpdate(UUID tenantId, UUID bookingId) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        return requireTenant(booking, tenantId);
    }

    private Booking requireTenant(Booking booking, UUID tenantId) {
        if (!booking.getTenantId().equals(tenantId)) {
            throw new ForbiddenException("Booking " + booking.getId() + " belongs to another tenant", "TENANT_MISMATCH");
        }
        return booking;
    }
}
