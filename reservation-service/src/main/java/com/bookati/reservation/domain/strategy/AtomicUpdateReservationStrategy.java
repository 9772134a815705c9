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
 * Reservation through one guarded UPDATE:
 *
 *   UPDATE slots
 *   SET available_capacity = available_capacity - :quantity,
 *       booked_count = booked_count + :quantity
 *   WHERE id = :slotId
 *     AND is_available
 *     AND available_capacity >= :quantity + :heldElsewhere;
 *
 * A competing transaction on the same row waits for the row lock and then re-checks the guard
 * against the committed value, so two callers can never both take the last unit.
 * 0 rows affected means the reservation failed; the slot is then re-read only to explain why.
 */
@Slf4j
@Component("atomic")
@RequiredArgsConstructor
public class AtomicUpdateReservationStrategy implements CapacityReservationStrategy {

    private final SlotRepository repository;

    @Override
    @Transactional
    public void reserve(UUID slotId, int quantity, int heldElsewhere) {
        int updatedRows = repository.reserveAtomically(slotId, quantity, quantity + heldElsewhere);
        if (updatedRows == 1) {
            log.debug("Reserved {} on slot {} (held elsewhere: {})", quantity, slotId, heldElsewhere);
            return;
        }
        throw explainFailure(slotId, quantity, heldElsewhere);
    }

    @Override
    public String getStrategyType() {
        return "ATOMIC_UPDATE";
    }

    private RuntimeException explainFailure(UUID slotId, int quantity, int heldElsewhere) {
        Slot slot = repository.findById(slotId).orElse(null);
        if (slot == null) {
            return new ResourceNotFoundException("Slot", slotId);
        }
        if (!slot.isAvailable()) {
            return new SlotUnavailableException(slotId);
        }
        return new CapacityExhaustedException(slotId, slot.getAvailableCapacity() - heldElsewhere, quantity);
    }
}
