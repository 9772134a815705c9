package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ValidationException;

/**
 * Split of a visitor count into a package-covered part and a paid part.
 */
public record CoverageSplit(int covered, int paid) {

    public static CoverageSplit resolve(int requested, int remaining) {
        if (requested < 1) {
            throw new ValidationException("Requested quantity must be at least 1");
        }
        int covered = Math.min(requested, Math.max(remaining, 0));
        return new CoverageSplit(covered, requested - covered);
    }

    public static CoverageSplit allPaid(int requested) {
        return resolve(requested, 0);
    }
}
