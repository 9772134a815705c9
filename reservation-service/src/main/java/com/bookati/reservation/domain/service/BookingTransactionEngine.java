package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ValidationException;
import com.bookati.common.util.Constants;
import com.bookati.reservation.api.dto.BookingResponse;
import com.bookati.reservation.api.dto.BulkBookingResponse;
import com.bookati.reservation.api.dto.CreateBookingRequest;
import com.bookati.reservation.api.dto.CreateBulkBookingRequest;
import com.bookati.reservation.domain.exception.CapacityExhaustedException;
import com.bookati.reservation.domain.exception.DuplicateBookingGroupException;
import com.bookati.reservation.domain.exception.PackageBalanceChangedException;
import com.bookati.reservation.domain.model.Booking;
import com.bookati.reservation.domain.model.BookingGroup;
import com.bookati.reservation.domain.model.ServiceOffering;
import com.bookati.reservation.domain.model.Slot;
import com.bookati.reservation.domain.repository.BookingGroupRepository;
import com.bookati.reservation.domain.repository.BookingRepository;
import com.bookati.reservation.events.BookingEventPublisher;
import com.bookati.reservation.events.TicketRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns booking requests into committed bookings.
 *
 * One transaction covers the slot reservation, the package debit, the booking rows and their
 * outbox events, so a failure anywhere leaves capacity and package balances untouched.
 * Deadlocks, lock timeouts and a package balance spent by a concurrent booking restart the
 * whole transaction (Spring Retry wraps the transactional proxy).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingTransactionEngine {

    private final BookingRepository bookingRepository;
    private final BookingGroupRepository bookingGroupRepository;
    private final SlotCapacityService slotCapacityService;
    private final ReservationLockService lockService;
    private final PackageCapacityResolver packageResolver;
    private final CatalogLookupService catalog;
    private final BookingEventPublisher eventPublisher;
    private final Clock clock;

    @Retryable(retryFor = {PessimisticLockingFailureException.class, PackageBalanceChangedException.class},
            maxAttempts = 3, backoff = @Backoff(delay = 100, multiplier = 2))
    @Transactional(timeoutString = "${reservation.booking.transaction-timeout-seconds:10}")
    public BookingResponse create(CreateBookingRequest request) {
        log.info("Creating booking on slot {} for {} visitor(s), tenant {}",
                request.slotId(), request.visitorCount(), request.tenantId());

        VisitorMix mix = VisitorMix.of(request.visitorCount(), request.adultCount(), request.childCount());
        int quantity = mix.visitors();
        String phone = catalog.normalizePhone(request.customerPhone());

        catalog.requireActiveTenant(request.tenantId());
        ServiceOffering service = catalog.requireBookableService(request.serviceId(), request.tenantId());
        Slot slot = slotCapacityService.requireBookableSlot(request.slotId(), request.tenantId(), request.serviceId());
        UUID customerId = catalog.resolveCustomerId(request.tenantId(), request.customerId(), phone).orElse(null);

        if (request.lockId() != null) {
            lockService.requireUsableLock(request.lockId(), request.sessionId(), slot.getId(), quantity);
        }

        BigDecimal unitPrice = catalog.unitPrice(service, request.offerId());
        PackageCoverage coverage = packageResolver.resolve(request.tenantId(), customerId, service.getId(), quantity);
        BigDecimal totalPrice = price(coverage.paid(), unitPrice);

        int heldElsewhere = lockService.heldCapacity(slot.getId(), request.lockId());
        slotCapacityService.reserve(slot.getId(), quantity, heldElsewhere);
        packageResolver.debit(coverage, service.getId(), customerId);

        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = bookingRepository.save(Booking.builder()
                .tenantId(request.tenantId())
                .serviceId(service.getId())
                .slotId(slot.getId())
                .employeeId(slot.getEmployeeId())
                .customerId(customerId)
                .customerName(request.customerName().trim())
                .customerPhone(phone)
                .customerEmail(request.customerEmail())
                .visitorCount(quantity)
                .adultCount(mix.adults())
                .childCount(mix.children())
                .packageCoveredQuantity(coverage.covered())
                .paidQuantity(coverage.paid())
                .totalPrice(totalPrice)
                .status(Booking.BookingStatus.CONFIRMED)
                .paymentStatus(initialPaymentStatus(request.paymentMethod()))
                .paymentMethod(request.paymentMethod())
                .packageSubscriptionId(coverage.hasCoverage() ? coverage.chosenSubscriptionId() : null)
                .offerId(request.offerId())
                .notes(request.notes())
                .language(request.language())
                .ticketToken(newTicketToken())
                .createdAt(now)
                .updatedAt(now)
                .build());

        if (request.lockId() != null) {
            lockService.consume(request.lockId(), request.sessionId());
        }

        eventPublisher.publishTicketRequested(booking, TicketRequestedEvent.TicketAction.CREATED);
        eventPublisher.publishInvoiceRequested(booking, unitPrice);

        log.info("Booking {} created: slot {}, {} covered by package, {} paid, total {}",
                booking.getId(), slot.getId(), coverage.covered(), coverage.paid(), totalPrice);
        return BookingResponse.from(booking);
    }

    /**
     * Books one visitor per entry of {@code slotIds}, all or nothing. Every slot is checked
     * before anything is written, and a failure after that rolls back every row.
     */
    @Retryable(retryFor = {PessimisticLockingFailureException.class, PackageBalanceChangedException.class},
            maxAttempts = 3, backoff = @Backoff(delay = 100, multiplier = 2))
    @Transactional(timeoutString = "${reservation.booking.transaction-timeout-seconds:10}")
    public BulkBookingResponse createBulk(CreateBulkBookingRequest request) {
        List<UUID> slotIds = request.slotIds();
        if (slotIds == null || slotIds.isEmpty()) {
            throw new ValidationException("At least one slot is required");
        }
        VisitorMix mix = VisitorMix.of(request.visitorCount(), request.adultCount(), request.childCount());
        int quantity = mix.visitors();
        log.info("Creating bulk booking over {} slot entries for tenant {}", slotIds.size(), request.tenantId());

        if (slotIds.size() != quantity) {
            throw new ValidationException(String.format(
                    "Number of slots (%d) must equal visitorCount (%d)", slotIds.size(), quantity));
        }
        if (slotIds.size() > Constants.MAX_BULK_SLOTS) {
            throw new ValidationException("A bulk booking can hold at most " + Constants.MAX_BULK_SLOTS + " slots");
        }
        String phone = catalog.normalizePhone(request.customerPhone());

        catalog.requireActiveTenant(request.tenantId());
        ServiceOffering service = catalog.requireBookableService(request.serviceId(), request.tenantId());
        UUID customerId = catalog.resolveCustomerId(request.tenantId(), request.customerId(), phone).orElse(null);
        BigDecimal unitPrice = catalog.unitPrice(service, request.offerId());

        UUID groupId = claimBookingGroup(request.bookingGroupId(), request.tenantId());
        Map<UUID, Slot> slots = precheckSlots(slotIds, request.tenantId(), service.getId());

        PackageCoverage coverage = packageResolver.resolve(request.tenantId(), customerId, service.getId(), quantity);
        if (coverage.paid() > 0 && unitPrice.signum() <= 0) {
            throw new ValidationException("Service has no price but " + coverage.paid() + " visitor(s) must be paid for",
                    "PRICE_NOT_SET");
        }

        for (UUID slotId : slotIds) {
            slotCapacityService.reserve(slotId, 1, lockService.heldCapacity(slotId, null));
        }
        packageResolver.debit(coverage, service.getId(), customerId);

        Booking.PaymentStatus paymentStatus = initialPaymentStatus(request.paymentMethod());
        LocalDateTime now = LocalDateTime.now(clock);
        List<Booking> rows = new ArrayList<>(quantity);
        for (int i = 0; i < quantity; i++) {
            Slot slot = slots.get(slotIds.get(i));
            boolean covered = i < coverage.covered();
            boolean adult = mix.isAdultRow(i);
            rows.add(Booking.builder()
                    .tenantId(request.tenantId())
                    .serviceId(service.getId())
                    .slotId(slot.getId())
                    .employeeId(slot.getEmployeeId())
                    .customerId(customerId)
                    .customerName(request.customerName().trim())
                    .customerPhone(phone)
                    .customerEmail(request.customerEmail())
                    .visitorCount(1)
                    .adultCount(adult ? 1 : 0)
                    .childCount(adult ? 0 : 1)
                    .packageCoveredQuantity(covered ? 1 : 0)
                    .paidQuantity(covered ? 0 : 1)
                    .totalPrice(covered ? BigDecimal.ZERO : unitPrice)
                    .status(Booking.BookingStatus.CONFIRMED)
                    .paymentStatus(paymentStatus)
                    .paymentMethod(request.paymentMethod())
                    .bookingGroupId(groupId)
                    .packageSubscriptionId(covered ? coverage.chosenSubscriptionId() : null)
                    .offerId(request.offerId())
                    .notes(request.notes())
                    .language(request.language())
                    .ticketToken(newTicketToken())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        List<Booking> saved = bookingRepository.saveAll(rows);

        for (Booking booking : saved) {
            eventPublisher.publishTicketRequested(booking, TicketRequestedEvent.TicketAction.CREATED);
            eventPublisher.publishInvoiceRequested(booking, unitPrice);
        }

        BulkBookingResponse response = BulkBookingResponse.from(groupId,
                saved.stream().map(BookingResponse::from).collect(Collectors.toList()));
        log.info("Bulk booking group {} created: {} bookings, {} covered by package, {} paid, total {}",
                groupId, response.totalBookings(), response.packageCoveredTotal(), response.paidTotal(),
                response.totalPrice());
        return response;
    }

    /**
     * Inserts the group row. Its primary key is the group id, so a concurrent duplicate fails here.
     */
    private UUID claimBookingGroup(UUID requestedGroupId, UUID tenantId) {
        UUID groupId = requestedGroupId != null ? requestedGroupId : UUID.randomUUID();
        if (requestedGroupId != null && bookingGroupRepository.existsById(requestedGroupId)) {
            throw new DuplicateBookingGroupException(requestedGroupId);
        }
        try {
            bookingGroupRepository.saveAndFlush(new BookingGroup(groupId, tenantId, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            log.warn("Booking group {} was claimed concurrently", groupId);
            throw new DuplicateBookingGroupException(groupId);
        }
        return groupId;
    }

    /**
     * Checks every distinct slot against the number of visitors asked of it and reports all
     * short slots together.
     */
    private Map<UUID, Slot> precheckSlots(List<UUID> slotIds, UUID tenantId, UUID serviceId) {
        Map<UUID, Integer> multiplicity = new LinkedHashMap<>();
        for (UUID slotId : slotIds) {
            multiplicity.merge(slotId, 1, Integer::sum);
        }

        Map<UUID, Slot> slots = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();
        for (Map.Entry<UUID, Integer> entry : multiplicity.entrySet()) {
            Slot slot = slotCapacityService.verifyBookable(entry.getKey(), tenantId, serviceId);
            slots.put(slot.getId(), slot);

            int effective = slot.getAvailableCapacity() - lockService.heldCapacity(slot.getId(), null);
            if (effective < entry.getValue()) {
                problems.add(String.format("slot %s on %s %s has %d available but %d requested",
                        slot.getId(), slot.getSlotDate(), slot.getStartTime(), Math.max(effective, 0), entry.getValue()));
            }
        }
        if (!problems.isEmpty()) {
            throw new CapacityExhaustedException("Not enough capacity: " + String.join("; ", problems));
        }
        return slots;
    }

    private BigDecimal price(int paid, BigDecimal unitPrice) {
        if (paid == 0) {
            return BigDecimal.ZERO;
        }
        if (unitPrice == null || unitPrice.signum() <= 0) {
            throw new ValidationException("Service has no price but " + paid + " visitor(s) must be paid for",
                    "PRICE_NOT_SET");
        }
        return unitPrice.multiply(BigDecimal.valueOf(paid));
    }

    private static Booking.PaymentStatus initialPaymentStatus(Booking.PaymentMethod paymentMethod) {
        return paymentMethod != null ? Booking.PaymentStatus.PAID_MANUAL : Booking.PaymentStatus.UNPAID;
    }

    static String newTicketToken() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
