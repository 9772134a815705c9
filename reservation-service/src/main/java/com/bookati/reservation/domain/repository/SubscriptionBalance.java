package com.bookati.reservation.domain.repository;

import java.util.UUID;

/**
 * Remaining quantity of one service within one active subscription.
 */
public record SubscriptionBalance(UUID subscriptionId, UUID usageId, Integer remaining) {
}
