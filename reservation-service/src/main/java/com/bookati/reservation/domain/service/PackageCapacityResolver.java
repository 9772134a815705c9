package com.bookati.reservation.domain.service;

import com.bookati.reservation.domain.exception.PackageBalanceChangedException;
import com.bookati.reservation.domain.model.PackageExhaustionNotice;
import com.bookati.reservation.domain.model.PackageSubscription;
import com.bookati.reservation.domain.model.SubscriptionUsage;
import com.bookati.reservation.domain.repository.PackageExhaustionNoticeRepository;
import com.bookati.reservation.domain.repository.SubscriptionBalance;
import com.bookati.reservation.domain.repository.SubscriptionUsageRepository;
import com.bookati.reservation.events.BookingEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Decides how much of a booking a customer's pre-purchased packages cover, and keeps the
 * usage ledger in step with bookings.
 *
 * Only one subscription is debited per booking: the one with the largest remaining balance
 * for the service, lowest subscription id on ties.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackageCapacityResolver {

    private static final Comparator<SubscriptionBalance> PREFERRED = Comparator
            .comparing(SubscriptionBalance::remaining, Comparator.reverseOrder())
            .thenComparing(SubscriptionBalance::subscriptionId);

    private final SubscriptionUsageRepository usageRepository;
    private final PackageExhaustionNoticeRepository exhaustionNoticeRepository;
    private final BookingEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Coverage for {@code quantity} visitors. A guest ({@code customerId == null}) is never looked up.
     */
    @Transactional(readOnly = true)
    public PackageCoverage resolve(UUID tenantId, UUID customerId, UUID serviceId, int quantity) {
        if (customerId == null) {
            return PackageCoverage.none(quantity);
        }

        List<SubscriptionBalance> balances = usageRepository.findUsableBalances(
                tenantId, customerId, serviceId,
                PackageSubscription.SubscriptionStatus.ACTIVE, LocalDateTime.now(clock));
        int total = balances.stream().mapToInt(SubscriptionBalance::remaining).sum();
        if (total == 0) {
            PackageCoverage none = PackageCoverage.none(quantity);
            return new PackageCoverage(balances, 0, null, none.covered(), none.paid(), false);
        }

        SubscriptionBalance chosen = balances.stream().min(PREFERRED).orElseThrow();
        CoverageSplit split = CoverageSplit.resolve(quantity, chosen.remaining());
        boolean exhausts = split.covered() == chosen.remaining();

        log.debug("Package coverage for customer {} on service {}: {} covered by subscription {}, {} paid",
                customerId, serviceId, split.covered(), chosen.subscriptionId(), split.paid());
        return new PackageCoverage(balances, total, chosen, split.covered(), split.paid(), exhausts);
    }

    /**
     * Debits the chosen subscription inside the booking transaction.
     *
     * @throws PackageBalanceChangedException when a concurrent booking spent the balance first;
     *                                        the caller retries the whole booking
     */
    @Transactional
    public void debit(PackageCoverage coverage, UUID serviceId, UUID customerId) {
        if (!coverage.hasCoverage()) {
            return;
        }
        SubscriptionBalance chosen = coverage.chosen();
        int updated = usageRepository.debitAtomically(chosen.usageId(), coverage.covered(), LocalDateTime.now(clock));
        if (updated == 0) {
            throw new PackageBalanceChangedException(chosen.subscriptionId());
        }
        log.info("Debited {} from subscription {} for service {}", coverage.covered(), chosen.subscriptionId(), serviceId);

        SubscriptionUsage usage = usageRepository.findById(chosen.usageId())
                .orElseThrow(() -> new IllegalStateException("Usage row " + chosen.usageId() + " vanished after debit"));
        if (usage.getRemainingQuantity() == 0) {
            recordExhaustion(chosen.subscriptionId(), serviceId, customerId);
        }
    }

    /**
     * Gives {@code quantity} back to the subscription's usage row for the service, bounded by
     * what was used. A missing usage row is logged and skipped.
     *
     * @return units credited
     */
    @Transactional
    public int credit(UUID subscriptionId, UUID serviceId, int quantity) {
        if (quantity < 1) {
            return 0;
        }
        return usageRepository.findForUpdate(subscriptionId, serviceId)
                .map(usage -> {
                    int credited = usage.credit(quantity, LocalDateTime.now(clock));
                    usageRepository.save(usage);
                    log.info("Credited {} back to subscription {} for service {}", credited, subscriptionId, serviceId);
                    return credited;
                })
                .orElseGet(() -> {
                    log.warn("No usage row for subscription {} and service {}, nothing credited", subscriptionId, serviceId);
                    return 0;
                });
    }

    private void recordExhaustion(UUID subscriptionId, UUID serviceId, UUID customerId) {
        if (exhaustionNoticeRepository.existsBySubscriptionIdAndServiceId(subscriptionId, serviceId)) {
            return;
        }
        exhaustionNoticeRepository.save(PackageExhaustionNotice.builder()
                .subscriptionId(subscriptionId)
                .serviceId(serviceId)
                .createdAt(LocalDateTime.now(clock))
                .build());
        eventPublisher.publishPackageExhausted(subscriptionId, serviceId, customerId);
        log.info("Subscription {} exhausted for service {}", subscriptionId, serviceId);
    }
}
