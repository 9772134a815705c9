package com.bookati.reservation.domain.strategy;

import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.reservation.domain.exception.CapacityExhaustedException;
import com.bookati.reservation.domain.exception.SlotUnavailableException;
import com.bookati.reservation.domain.model.Slot;
import com.bookati.reservation.domain.repository.SlotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Reservation strategy using pessimistic lock (SELECT FOR UPDATE).
 *
 * The row stays locked until the surrounding booking transaction commits, which also
 * serializes the booking insert behind it. The lock wait is bounded by a query hint.
 *
 * Flow:
 * 1. Acquire row lock
 * 2. Check availability flag and effective capacity
 * 3. Move capacity from available to booked
 * 4. Flush on commit
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockReservationStrategy implements CapacityReservationStrategy {

    private final SlotRepository repository;

    @Override
    @Transactional
    public void reserve(UUID slotId, int quantity, int heldElsewhere) {
        Slot slot = repository.findByIdForUpdate(slotId)
                .orElseThrow(() -> new ResourceNotFoundException("Slot", slotId));

        if (!slot.isAvailable()) {
            throw new SlotUnavailableException(slotId);
        }
        int effective = slot.getAvailableCapacity() - heldElsewhere;
        if (effective < quantity) {
            throw new CapacityExhaustedException(slotId, effective, quantity);
        }

        slot.reserve(quantity);
        repository.save(slot);
        log.debug("Reserved {} on slot {} under row lock, {} left", quantity, slotId, slot.getAvailableCapacity());
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
