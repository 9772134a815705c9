package com.bookati.reservation.api.dto;

import java.util.UUID;

/**
 * Availability as the booking UI sees it: {@code effectiveCapacity} already excludes
 * capacity held by unexpired checkout locks.
 */
public record SlotAvailabilityResponse(
        UUID slotId,
        boolean available,
        int availableCapacity,
        int lockedCapacity,
        int effectiveCapacity
) {
}
