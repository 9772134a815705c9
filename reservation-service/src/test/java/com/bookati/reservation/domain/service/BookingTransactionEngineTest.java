package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ValidationException;
import com.bookati.reservation.api.dto.BookingResponse;
import com.bookati.reservation.api.dto.BulkBookingResponse;
import com.bookati.reservation.api.dto.CreateBookingRequest;
import com.bookati.reservation.api.dto.CreateBulkBookingRequest;
import com.bookati.reservation.domain.exception.CapacityExhaustedException;
import com.bookati.reservation.domain.exception.DuplicateBookingGroupException;
import com.bookati.reservation.domain.model.Booking;
import com.bookati.reservation.domain.model.BookingGroup;
import com.bookati.reservation.domain.model.ServiceOffering;
import com.bookati.reservation.domain.model.Slot;
import com.bookati.reservation.domain.repository.BookingGroupRepository;
import com.bookati.reservation.domain.repository.BookingRepository;
import com.bookati.reservation.domain.repository.SubscriptionBalance;
import com.bookati.reservation.events.BookingEventPublisher;
import com.bookati.reservation.events.TicketRequestedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BookingTransactionEngineTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID CUSTOMER = UUID.randomUUID();
    private static final String PHONE = "+201001234567";

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingGroupRepository bookingGroupRepository;
    @Mock
    private SlotCapacityService slotCapacityService;
    @Mock
    private ReservationLockService lockService;
    @Mock
    private PackageCapacityResolver packageResolver;
    @Mock
    private CatalogLookupService catalog;
    @Mock
    private BookingEventPublisher eventPublisher;

    private BookingTransactionEngine engine;
    private ServiceOffering service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        engine = new BookingTransactionEngine(bookingRepository, bookingGroupRepository, slotCapacityService,
                lockService, packageResolver, catalog, eventPublisher, clock);
        service = ServiceOffering.builder()
                .id(UUID.randomUUID())
                .tenantId(TENANT)
                .name("Guided tour")
                .unitPrice(new BigDecimal("10.00"))
                .defaultCapacity(20)
                .active(true)
                .build();

        lenient().when(catalog.normalizePhone(any())).thenReturn(PHONE);
        lenient().when(catalog.requireBookableService(service.getId(), TENANT)).thenReturn(service);
        lenient().when(catalog.resolveCustomerId(eq(TENANT), any(), eq(PHONE))).thenReturn(Optional.of(CUSTOMER));
        lenient().when(catalog.unitPrice(eq(service), any())).thenAnswer(inv -> service.getUnitPrice());
        lenient().when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(bookingRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("splits 5 visitors into 2 package-covered and 3 paid, priced 3 x unit")
        void create_packageSplit() {
            Slot slot = slot(10);
            SubscriptionBalance balance = new SubscriptionBalance(UUID.randomUUID(), UUID.randomUUID(), 2);
            PackageCoverage coverage = new PackageCoverage(List.of(balance), 2, balance, 2, 3, true);
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 5)).willReturn(coverage);

            BookingResponse response = engine.create(request(slot.getId(), 5, null, null));

            assertThat(response.packageCoveredQuantity()).isEqualTo(2);
            assertThat(response.paidQuantity()).isEqualTo(3);
            assertThat(response.totalPrice()).isEqualByComparingTo("30.00");
            assertThat(response.packageSubscriptionId()).isEqualTo(balance.subscriptionId());
            assertThat(response.status()).isEqualTo(Booking.BookingStatus.CONFIRMED);
            assertThat(response.paymentStatus()).isEqualTo(Booking.PaymentStatus.UNPAID);
            assertThat(response.customerPhone()).isEqualTo(PHONE);
            assertThat(response.ticketToken()).hasSize(32);

            verify(slotCapacityService).reserve(slot.getId(), 5, 0);
            verify(packageResolver).debit(coverage, service.getId(), CUSTOMER);
            verify(eventPublisher).publishTicketRequested(any(Booking.class), eq(TicketRequestedEvent.TicketAction.CREATED));
            verify(eventPublisher).publishInvoiceRequested(any(Booking.class), eq(new BigDecimal("10.00")));
        }

        @Test
        @DisplayName("fully covered booking costs nothing and carries no payment")
        void create_fullyCovered() {
            Slot slot = slot(10);
            SubscriptionBalance balance = new SubscriptionBalance(UUID.randomUUID(), UUID.randomUUID(), 6);
            PackageCoverage coverage = new PackageCoverage(List.of(balance), 6, balance, 3, 0, false);
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 3)).willReturn(coverage);

            BookingResponse response = engine.create(request(slot.getId(), 3, null, null));

            assertThat(response.totalPrice()).isEqualByComparingTo("0");
            assertThat(response.paidQuantity()).isZero();
        }

        @Test
        @DisplayName("payment method taken at the desk marks the booking paid manually")
        void create_paidAtDesk() {
            Slot slot = slot(10);
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 1)).willReturn(PackageCoverage.none(1));

            CreateBookingRequest request = new CreateBookingRequest(TENANT, service.getId(), slot.getId(), "Mona",
                    "01001234567", null, null, 1, null, null, null, null, null, null, "en", Booking.PaymentMethod.CASH);
            BookingResponse response = engine.create(request);

            assertThat(response.paymentStatus()).isEqualTo(Booking.PaymentStatus.PAID_MANUAL);
            assertThat(response.paymentMethod()).isEqualTo(Booking.PaymentMethod.CASH);
            assertThat(response.packageSubscriptionId()).isNull();
        }

        @Test
        @DisplayName("checkout lock is validated, excluded from held capacity and consumed")
        void create_withLock() {
            Slot slot = slot(10);
            UUID lockId = UUID.randomUUID();
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 2)).willReturn(PackageCoverage.none(2));
            given(lockService.heldCapacity(slot.getId(), lockId)).willReturn(3);

            engine.create(request(slot.getId(), 2, lockId, "session_1"));

            verify(lockService).requireUsableLock(lockId, "session_1", slot.getId(), 2);
            verify(slotCapacityService).reserve(slot.getId(), 2, 3);
            verify(lockService).consume(lockId, "session_1");
        }

        @Test
        @DisplayName("paid visitors on a service without price are rejected before reserving")
        void create_priceNotSet() {
            Slot slot = slot(10);
            service.setUnitPrice(BigDecimal.ZERO);
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 1)).willReturn(PackageCoverage.none(1));

            assertThatThrownBy(() -> engine.create(request(slot.getId(), 1, null, null)))
                    .isInstanceOf(ValidationException.class)
                    .extracting("errorCode").isEqualTo("PRICE_NOT_SET");
            verify(slotCapacityService, never()).reserve(any(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("capacity failure leaves the package balance and bookings untouched")
        void create_capacityExhausted() {
            Slot slot = slot(1);
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 2)).willReturn(PackageCoverage.none(2));
            willThrow(new CapacityExhaustedException(slot.getId(), 1, 2))
                    .given(slotCapacityService).reserve(slot.getId(), 2, 0);

            assertThatThrownBy(() -> engine.create(request(slot.getId(), 2, null, null)))
                    .isInstanceOf(CapacityExhaustedException.class);
            verify(packageResolver, never()).debit(any(), any(), any());
            verify(bookingRepository, never()).save(any());
            verify(eventPublisher, never()).publishTicketRequested(any(), any());
        }

        @Test
        @DisplayName("adult and child counts are advisory and stored as given")
        void create_visitorMixIsAdvisory() {
            Slot slot = slot(10);
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 3)).willReturn(PackageCoverage.none(3));
            CreateBookingRequest request = new CreateBookingRequest(TENANT, service.getId(), slot.getId(), "Mona",
                    "01001234567", null, CUSTOMER, 3, 2, 2, null, null, null, null, "en", null);

            BookingResponse response = engine.create(request);

            assertThat(response.visitorCount()).isEqualTo(3);
            assertThat(response.adultCount()).isEqualTo(2);
            assertThat(response.childCount()).isEqualTo(2);
            assertThat(response.totalPrice()).isEqualByComparingTo("30.00");
            verify(slotCapacityService).reserve(slot.getId(), 3, 0);
        }

        @Test
        @DisplayName("a missing breakdown defaults to all adults")
        void create_visitorMixDefaults() {
            Slot slot = slot(10);
            given(slotCapacityService.requireBookableSlot(slot.getId(), TENANT, service.getId())).willReturn(slot);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 3)).willReturn(PackageCoverage.none(3));

            BookingResponse response = engine.create(request(slot.getId(), 3, null, null));

            assertThat(response.adultCount()).isEqualTo(3);
            assertThat(response.childCount()).isZero();
        }

        @Test
        @DisplayName("negative child count is rejected before any capacity is touched")
        void create_negativeChildren() {
            CreateBookingRequest request = new CreateBookingRequest(TENANT, service.getId(), UUID.randomUUID(), "Mona",
                    "01001234567", null, null, 3, 3, -1, null, null, null, null, "en", null);

            assertThatThrownBy(() -> engine.create(request)).isInstanceOf(ValidationException.class);
            verify(slotCapacityService, never()).reserve(any(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("a missing visitor count is a validation error, not a server error")
        void create_missingVisitorCount() {
            CreateBookingRequest request = new CreateBookingRequest(TENANT, service.getId(), UUID.randomUUID(), "Mona",
                    "01001234567", null, null, null, null, null, null, null, null, null, "en", null);

            assertThatThrownBy(() -> engine.create(request))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("visitorCount must be at least 1");
            verify(bookingRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("createBulk()")
    class CreateBulk {

        @Test
        @DisplayName("slot count must equal the visitor count")
        void createBulk_sizeMismatch() {
            CreateBulkBookingRequest request = bulkRequest(List.of(UUID.randomUUID(), UUID.randomUUID()), 3, null, null);

            assertThatThrownBy(() -> engine.createBulk(request))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Number of slots (2) must equal visitorCount (3)");
            verify(bookingGroupRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("a booking group id that already exists is rejected without touching capacity")
        void createBulk_duplicateGroup() {
            UUID groupId = UUID.randomUUID();
            given(bookingGroupRepository.existsById(groupId)).willReturn(true);

            assertThatThrownBy(() -> engine.createBulk(bulkRequest(List.of(UUID.randomUUID()), 1, groupId, null)))
                    .isInstanceOf(DuplicateBookingGroupException.class);
            verify(slotCapacityService, never()).reserve(any(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("every short slot is reported together and nothing is reserved")
        void createBulk_precheckCollectsProblems() {
            Slot first = slot(1);
            Slot second = slot(0);
            given(slotCapacityService.verifyBookable(first.getId(), TENANT, service.getId())).willReturn(first);
            given(slotCapacityService.verifyBookable(second.getId(), TENANT, service.getId())).willReturn(second);
            given(lockService.heldCapacity(any(), isNull())).willReturn(0);

            List<UUID> slotIds = List.of(first.getId(), first.getId(), second.getId());

            assertThatThrownBy(() -> engine.createBulk(bulkRequest(slotIds, 3, null, null)))
                    .isInstanceOf(CapacityExhaustedException.class)
                    .hasMessageContaining(first.getId() + " on 2026-04-01 09:00 has 1 available but 2 requested")
                    .hasMessageContaining(second.getId() + " on 2026-04-01 09:00 has 0 available but 1 requested");
            verify(slotCapacityService, never()).reserve(any(), anyInt(), anyInt());
            verify(packageResolver, never()).resolve(any(), any(), any(), anyInt());
        }

        @Test
        @DisplayName("one row per visitor; covered rows first, adults first")
        void createBulk_success() {
            Slot first = slot(5);
            Slot second = slot(5);
            given(slotCapacityService.verifyBookable(first.getId(), TENANT, service.getId())).willReturn(first);
            given(slotCapacityService.verifyBookable(second.getId(), TENANT, service.getId())).willReturn(second);
            given(lockService.heldCapacity(any(), isNull())).willReturn(0);
            SubscriptionBalance balance = new SubscriptionBalance(UUID.randomUUID(), UUID.randomUUID(), 1);
            PackageCoverage coverage = new PackageCoverage(List.of(balance), 1, balance, 1, 2, true);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 3)).willReturn(coverage);

            UUID groupId = UUID.randomUUID();
            List<UUID> slotIds = List.of(first.getId(), first.getId(), second.getId());
            CreateBulkBookingRequest request = new CreateBulkBookingRequest(TENANT, service.getId(), slotIds, "Omar",
                    "01001234567", null, null, 3, 2, 1, groupId, null, null, "ar", null);

            BulkBookingResponse response = engine.createBulk(request);

            assertThat(response.bookingGroupId()).isEqualTo(groupId);
            assertThat(response.totalBookings()).isEqualTo(3);
            assertThat(response.packageCoveredTotal()).isEqualTo(1);
            assertThat(response.paidTotal()).isEqualTo(2);
            assertThat(response.totalPrice()).isEqualByComparingTo("20.00");

            List<BookingResponse> rows = response.bookings();
            assertThat(rows).extracting(BookingResponse::slotId)
                    .containsExactly(first.getId(), first.getId(), second.getId());
            assertThat(rows).extracting(BookingResponse::packageCoveredQuantity).containsExactly(1, 0, 0);
            assertThat(rows).extracting(BookingResponse::childCount).containsExactly(0, 0, 1);
            assertThat(rows.get(0).packageSubscriptionId()).isEqualTo(balance.subscriptionId());
            assertThat(rows.get(1).packageSubscriptionId()).isNull();
            assertThat(rows).extracting(BookingResponse::bookingGroupId).containsOnly(groupId);
            assertThat(rows).extracting(BookingResponse::ticketToken).doesNotHaveDuplicates();

            ArgumentCaptor<BookingGroup> group = ArgumentCaptor.forClass(BookingGroup.class);
            verify(bookingGroupRepository).saveAndFlush(group.capture());
            assertThat(group.getValue().getId()).isEqualTo(groupId);
            verify(slotCapacityService, times(2)).reserve(first.getId(), 1, 0);
            verify(slotCapacityService).reserve(second.getId(), 1, 0);
            verify(packageResolver).debit(coverage, service.getId(), CUSTOMER);
            verify(eventPublisher, times(3)).publishTicketRequested(any(Booking.class),
                    eq(TicketRequestedEvent.TicketAction.CREATED));
        }
    }

    @Nested
    @DisplayName("createBulk() visitor breakdown")
    class CreateBulkVisitorMix {

        @Test
        @DisplayName("an adult count above the visitor count marks every row as adult")
        void createBulk_adultCountClamped() {
            Slot first = slot(5);
            given(slotCapacityService.verifyBookable(first.getId(), TENANT, service.getId())).willReturn(first);
            given(lockService.heldCapacity(any(), isNull())).willReturn(0);
            given(packageResolver.resolve(TENANT, CUSTOMER, service.getId(), 2)).willReturn(PackageCoverage.none(2));
            CreateBulkBookingRequest request = new CreateBulkBookingRequest(TENANT, service.getId(),
                    List.of(first.getId(), first.getId()), "Omar", "01001234567", null, CUSTOMER,
                    2, 5, 1, null, null, null, "en", null);

            BulkBookingResponse response = engine.createBulk(request);

            assertThat(response.bookings()).extracting(BookingResponse::adultCount).containsExactly(1, 1);
            assertThat(response.bookings()).extracting(BookingResponse::childCount).containsExactly(0, 0);
        }

        @Test
        @DisplayName("a missing slot list is a validation error")
        void createBulk_missingSlots() {
            CreateBulkBookingRequest request = bulkRequest(null, 1, null, null);

            assertThatThrownBy(() -> engine.createBulk(request))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("At least one slot is required");
            verify(bookingGroupRepository, never()).saveAndFlush(any());
        }
    }

    private CreateBookingRequest request(UUID slotId, int visitors, UUID lockId, String sessionId) {
        return new CreateBookingRequest(TENANT, service.getId(), slotId, "Mona", "01001234567", null, CUSTOMER,
                visitors, null, null, lockId, sessionId, null, null, "en", null);
    }

    private CreateBulkBookingRequest bulkRequest(List<UUID> slotIds, int visitors, UUID groupId,
                                                 Booking.PaymentMethod paymentMethod) {
        return new CreateBulkBookingRequest(TENANT, service.getId(), slotIds, "Omar", "01001234567", null, CUSTOMER,
                visitors, null, null, groupId, null, null, "en", paymentMethod);
    }

    private Slot slot(int available) {
        return Slot.builder()
                .id(UUID.randomUUID())
                .tenantId(TENANT)
                .serviceId(service.getId())
                .employeeId(UUID.randomUUID())
                .slotDate(LocalDate.of(2026, 4, 1))
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(10, 0))
                .originalCapacity(10)
                .availableCapacity(available)
                .bookedCount(10 - available)
                .available(true)
                .build();
    }
}
