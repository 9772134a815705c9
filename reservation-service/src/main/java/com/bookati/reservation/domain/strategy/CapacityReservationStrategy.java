package com.bookati.reservation.domain.strategy;

import java.util.UUID;

/**
 * Strategy interface for taking capacity from a slot under a specific concurrency control mechanism.
 *
 * Implementations:
 * - AtomicUpdateReservationStrategy: single guarded UPDATE, the database row lock does the serializing
 * - PessimisticLockReservationStrategy: SELECT FOR UPDATE, then check and mutate the entity
 * - DistributedLockReservationStrategy: Redisson lock per slot around the guarded UPDATE
 *
 * Every implementation joins the caller's transaction, so a later failure in the same
 * unit of work rolls the reservation back.
 */
public interface CapacityReservationStrategy {

    /**
     * Reserves {@code quantity} on the slot, leaving {@code heldElsewhere} untouched for
     * other checkout sessions.
     *
     * @throws com.bookati.common.exception.ResourceNotFoundException if the slot does not exist
     * @throws com.bookati.reservation.domain.exception.SlotUnavailableException if the slot is switched off
     * @throws com.bookati.reservation.domain.exception.CapacityExhaustedException if capacity is short
     */
    void reserve(UUID slotId, int quantity, int heldElsewhere);

    /**
     * @return Strategy type (ATOMIC_UPDATE, PESSIMISTIC_LOCK, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}
