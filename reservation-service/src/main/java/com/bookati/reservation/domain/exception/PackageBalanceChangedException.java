package com.bookati.reservation.domain.exception;

import com.bookati.common.exception.ConflictException;

import java.util.UUID;

/**
 * Subscription balance shrank between resolution and debit. The booking transaction is retried.
 */
public class PackageBalanceChangedException extends ConflictException {

    public PackageBalanceChangedException(UUID subscriptionId) {
        super("Package balance of subscription " + subscriptionId + " changed, please retry",
                "PACKAGE_BALANCE_CHANGED");
    }
}
