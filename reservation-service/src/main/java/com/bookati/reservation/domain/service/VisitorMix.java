package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ValidationException;

/**
 * Adult and child breakdown of a booking. It is advisory: it need not add up to the visitor
 * count, which alone drives capacity and pricing. Missing values default to all adults.
 */
record VisitorMix(int visitors, int adults, int children) {

    static VisitorMix of(Integer visitorCount, Integer adultCount, Integer childCount) {
        if (visitorCount == null || visitorCount < 1) {
            throw new ValidationException("visitorCount must be at least 1, got " + visitorCount);
        }
        int adults = adultCount != null ? adultCount : visitorCount;
        int children = childCount != null ? childCount : 0;
        if (adults < 0 || children < 0) {
            throw new ValidationException(String.format(
                    "adultCount (%d) and childCount (%d) cannot be negative", adults, children));
        }
        return new VisitorMix(visitorCount, adults, children);
    }

    /**
     * Whether the row at {@code index} of a one-visitor-per-row group is an adult.
     */
    boolean isAdultRow(int index) {
        return index < Math.min(adults, visitors);
    }
}
