package com.bookati.reservation.domain.service;

import com.bookati.reservation.domain.repository.SubscriptionBalance;

import java.util.List;
import java.util.UUID;

/**
 * Result of a package lookup for one booking. At most one subscription, {@code chosen}, is debited.
 */
public record PackageCoverage(
        List<SubscriptionBalance> balances,
        int totalRemaining,
        SubscriptionBalance chosen,
        int covered,
        int paid,
        boolean exhaustsChosen
) {

    public static PackageCoverage none(int requested) {
        CoverageSplit split = CoverageSplit.allPaid(requested);
        return new PackageCoverage(List.of(), 0, null, split.covered(), split.paid(), false);
    }

    public UUID chosenSubscriptionId() {
        return chosen == null ? null : chosen.subscriptionId();
    }

    public boolean hasCoverage() {
        return chosen != null && covered > 0;
    }
}
