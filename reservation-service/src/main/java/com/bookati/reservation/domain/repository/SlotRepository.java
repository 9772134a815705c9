package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.Slot;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Capacity store for slots. All capacity mutations are single guarded statements, so the
 * database row lock serializes concurrent reservations on the same slot.
 */
public interface SlotRepository extends JpaRepository<Slot, UUID> {

    /**
     * SELECT FOR UPDATE with a bounded wait; a competing holder past the timeout
     * surfaces as a PessimisticLockingFailureException.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT s FROM Slot s WHERE s.id = :id")
    Optional<Slot> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Atomically moves {@code quantity} from available to booked.
     * {@code required} is the quantity plus whatever other checkout sessions currently hold,
     * so the guard keeps their holds intact.
     *
     * Returns the number of rows affected:
     * - 1: success
     * - 0: slot missing, flagged unavailable, or not enough capacity
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Slot s
           SET s.availableCapacity = s.availableCapacity - :quantity,
               s.bookedCount = s.bookedCount + :quantity
           WHERE s.id = :id
             AND s.available = true
             AND s.availableCapacity >= :required
           """)
    int reserveAtomically(@Param("id") UUID id,
                          @Param("quantity") int quantity,
                          @Param("required") int required);

    /**
     * Returns capacity, clamped at the original capacity.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Slot s
           SET s.availableCapacity = CASE
                   WHEN s.availableCapacity + :quantity > s.originalCapacity THEN s.originalCapacity
                   ELSE s.availableCapacity + :quantity END,
               s.bookedCount = CASE
                   WHEN s.availableCapacity + :quantity > s.originalCapacity THEN 0
                   ELSE s.bookedCount - :quantity END
           WHERE s.id = :id
           """)
    int releaseAtomically(@Param("id") UUID id, @Param("quantity") int quantity);
}
