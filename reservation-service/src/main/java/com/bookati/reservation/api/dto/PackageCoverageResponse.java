package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.service.PackageCoverage;

import java.util.List;
import java.util.UUID;

public record PackageCoverageResponse(
        int totalRemainingCapacity,
        List<SubscriptionRemaining> subscriptions,
        UUID chosenSubscriptionId,
        int covered,
        int paid,
        boolean exhaustsChosen
) {
    public record SubscriptionRemaining(UUID subscriptionId, int remaining) {
    }

    public static PackageCoverageResponse from(PackageCoverage coverage) {
        List<SubscriptionRemaining> subscriptions = coverage.balances().stream()
                .map(balance -> new SubscriptionRemaining(balance.subscriptionId(), balance.remaining()))
                .toList();
        return new PackageCoverageResponse(
                coverage.totalRemaining(),
                subscriptions,
                coverage.chosenSubscriptionId(),
                coverage.covered(),
                coverage.paid(),
                coverage.exhaustsChosen()
        );
    }
}
