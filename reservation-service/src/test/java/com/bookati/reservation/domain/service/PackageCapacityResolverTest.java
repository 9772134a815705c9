package com.bookati.reservation.domain.service;

import com.bookati.reservation.domain.exception.PackageBalanceChangedException;
import com.bookati.reservation.domain.model.PackageExhaustionNotice;
import com.bookati.reservation.domain.model.PackageSubscription;
import com.bookati.reservation.domain.model.SubscriptionUsage;
import com.bookati.reservation.domain.repository.PackageExhaustionNoticeRepository;
import com.bookati.reservation.domain.repository.SubscriptionBalance;
import com.bookati.reservation.domain.repository.SubscriptionUsageRepository;
import com.bookati.reservation.events.BookingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PackageCapacityResolverTest {

    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID CUSTOMER = UUID.fromString("00000000-0000-0000-0000-00000000000c");
    private static final UUID SERVICE = UUID.fromString("00000000-0000-0000-0000-00000000000e");
    private static final UUID SUB_LOW = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID SUB_HIGH = UUID.fromString("00000000-0000-0000-0000-000000000002");

    @Mock
    private SubscriptionUsageRepository usageRepository;
    @Mock
    private PackageExhaustionNoticeRepository exhaustionNoticeRepository;
    @Mock
    private BookingEventPublisher eventPublisher;

    private PackageCapacityResolver resolver;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
        resolver = new PackageCapacityResolver(usageRepository, exhaustionNoticeRepository, eventPublisher, clock);
    }

    @Test
    @DisplayName("guest bookings are never looked up and are fully paid")
    void resolve_guest_allPaid() {
        PackageCoverage coverage = resolver.resolve(TENANT, null, SERVICE, 4);

        assertThat(coverage.covered()).isZero();
        assertThat(coverage.paid()).isEqualTo(4);
        assertThat(coverage.chosen()).isNull();
        verifyNoInteractions(usageRepository);
    }

    @Test
    @DisplayName("no usable subscription means no coverage")
    void resolve_noBalances_allPaid() {
        given(usageRepository.findUsableBalances(eq(TENANT), eq(CUSTOMER), eq(SERVICE),
                eq(PackageSubscription.SubscriptionStatus.ACTIVE), any())).willReturn(List.of());

        PackageCoverage coverage = resolver.resolve(TENANT, CUSTOMER, SERVICE, 2);

        assertThat(coverage.hasCoverage()).isFalse();
        assertThat(coverage.totalRemaining()).isZero();
        assertThat(coverage.paid()).isEqualTo(2);
    }

    @Test
    @DisplayName("largest remaining subscription is chosen and only it covers the booking")
    void resolve_picksLargestRemaining() {
        SubscriptionBalance small = new SubscriptionBalance(SUB_LOW, UUID.randomUUID(), 2);
        SubscriptionBalance large = new SubscriptionBalance(SUB_HIGH, UUID.randomUUID(), 3);
        given(usageRepository.findUsableBalances(eq(TENANT), eq(CUSTOMER), eq(SERVICE), any(), any()))
                .willReturn(List.of(small, large));

        PackageCoverage coverage = resolver.resolve(TENANT, CUSTOMER, SERVICE, 5);

        assertThat(coverage.totalRemaining()).isEqualTo(5);
        assertThat(coverage.chosenSubscriptionId()).isEqualTo(SUB_HIGH);
        assertThat(coverage.covered()).isEqualTo(3);
        assertThat(coverage.paid()).isEqualTo(2);
        assertThat(coverage.exhaustsChosen()).isTrue();
    }

    @Test
    @DisplayName("ties on remaining go to the lowest subscription id")
    void resolve_tieBreaksOnLowestId() {
        SubscriptionBalance high = new SubscriptionBalance(SUB_HIGH, UUID.randomUUID(), 4);
        SubscriptionBalance low = new SubscriptionBalance(SUB_LOW, UUID.randomUUID(), 4);
        given(usageRepository.findUsableBalances(eq(TENANT), eq(CUSTOMER), eq(SERVICE), any(), any()))
                .willReturn(List.of(high, low));

        PackageCoverage coverage = resolver.resolve(TENANT, CUSTOMER, SERVICE, 1);

        assertThat(coverage.chosenSubscriptionId()).isEqualTo(SUB_LOW);
        assertThat(coverage.covered()).isEqualTo(1);
        assertThat(coverage.paid()).isZero();
        assertThat(coverage.exhaustsChosen()).isFalse();
    }

    @Test
    @DisplayName("debit that finds the balance already spent asks for a retry")
    void debit_zeroRows_throwsBalanceChanged() {
        SubscriptionBalance chosen = new SubscriptionBalance(SUB_LOW, UUID.randomUUID(), 2);
        PackageCoverage coverage = new PackageCoverage(List.of(chosen), 2, chosen, 2, 0, true);
        given(usageRepository.debitAtomically(eq(chosen.usageId()), eq(2), any())).willReturn(0);

        assertThatThrownBy(() -> resolver.debit(coverage, SERVICE, CUSTOMER))
                .isInstanceOf(PackageBalanceChangedException.class);
        verify(exhaustionNoticeRepository, never()).save(any());
    }

    @Test
    @DisplayName("debit to zero records one exhaustion notice and event")
    void debit_toZero_recordsExhaustion() {
        UUID usageId = UUID.randomUUID();
        SubscriptionBalance chosen = new SubscriptionBalance(SUB_LOW, usageId, 2);
        PackageCoverage coverage = new PackageCoverage(List.of(chosen), 2, chosen, 2, 1, true);
        given(usageRepository.debitAtomically(eq(usageId), eq(2), any())).willReturn(1);
        given(usageRepository.findById(usageId)).willReturn(Optional.of(usage(usageId, 2, 0)));
        given(exhaustionNoticeRepository.existsBySubscriptionIdAndServiceId(SUB_LOW, SERVICE)).willReturn(false);

        resolver.debit(coverage, SERVICE, CUSTOMER);

        verify(exhaustionNoticeRepository).save(any(PackageExhaustionNotice.class));
        verify(eventPublisher).publishPackageExhausted(SUB_LOW, SERVICE, CUSTOMER);
    }

    @Test
    @DisplayName("an existing exhaustion notice is not duplicated")
    void debit_toZero_noticeAlreadyPresent() {
        UUID usageId = UUID.randomUUID();
        SubscriptionBalance chosen = new SubscriptionBalance(SUB_LOW, usageId, 1);
        PackageCoverage coverage = new PackageCoverage(List.of(chosen), 1, chosen, 1, 0, true);
        given(usageRepository.debitAtomically(eq(usageId), eq(1), any())).willReturn(1);
        given(usageRepository.findById(usageId)).willReturn(Optional.of(usage(usageId, 1, 0)));
        given(exhaustionNoticeRepository.existsBySubscriptionIdAndServiceId(SUB_LOW, SERVICE)).willReturn(true);

        resolver.debit(coverage, SERVICE, CUSTOMER);

        verify(exhaustionNoticeRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("nothing is debited when the booking has no coverage")
    void debit_noCoverage_noop() {
        resolver.debit(PackageCoverage.none(3), SERVICE, CUSTOMER);

        verify(usageRepository, never()).debitAtomically(any(), anyInt(), any());
    }

    @Test
    @DisplayName("credit gives back at most what was used")
    void credit_boundedByUsed() {
        SubscriptionUsage usage = SubscriptionUsage.builder()
                .id(UUID.randomUUID())
                .subscriptionId(SUB_LOW)
                .serviceId(SERVICE)
                .originalQuantity(5)
                .usedQuantity(2)
                .remainingQuantity(3)
                .updatedAt(LocalDateTime.of(2026, 1, 1, 0, 0))
                .build();
        given(usageRepository.findForUpdate(SUB_LOW, SERVICE)).willReturn(Optional.of(usage));

        int credited = resolver.credit(SUB_LOW, SERVICE, 4);

        assertThat(credited).isEqualTo(2);
        assertThat(usage.getUsedQuantity()).isZero();
        assertThat(usage.getRemainingQuantity()).isEqualTo(5);
        verify(usageRepository).save(usage);
    }

    @Test
    @DisplayName("credit without a usage row is skipped")
    void credit_missingUsage_returnsZero() {
        given(usageRepository.findForUpdate(SUB_LOW, SERVICE)).willReturn(Optional.empty());

        assertThat(resolver.credit(SUB_LOW, SERVICE, 2)).isZero();
        verify(usageRepository, never()).save(any());
    }

    private SubscriptionUsage usage(UUID id, int used, int remaining) {
        return SubscriptionUsage.builder()
                .id(id)
                .subscriptionId(SUB_LOW)
                .serviceId(SERVICE)
                .originalQuantity(used + remaining)
                .usedQuantity(used)
                .remainingQuantity(remaining)
                .updatedAt(LocalDateTime.of(2026, 3, 1, 8, 0))
                .build();
    }
}
