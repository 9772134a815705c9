package com.bookati.reservation.domain.repository;

import java.util.UUID;

/**
 * Capacity held by unexpired reservation locks on one slot.
 */
public record LockedCapacity(UUID slotId, Long lockedCapacity) {
}
