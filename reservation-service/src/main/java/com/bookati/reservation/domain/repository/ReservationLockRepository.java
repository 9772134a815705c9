package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.ReservationLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ReservationLockRepository extends JpaRepository<ReservationLock, UUID> {

    @Query("""
           SELECT COALESCE(SUM(l.reservedCapacity), 0) FROM ReservationLock l
           WHERE l.slotId = :slotId AND l.expiresAt > :now
           """)
    long sumActiveReservedCapacity(@Param("slotId") UUID slotId, @Param("now") LocalDateTime now);

    @Query("""
           SELECT COALESCE(SUM(l.reservedCapacity), 0) FROM ReservationLock l
           WHERE l.slotId = :slotId AND l.expiresAt > :now AND l.id <> :excludedLockId
           """)
    long sumActiveReservedCapacityExcluding(@Param("slotId") UUID slotId,
                                            @Param("now") LocalDateTime now,
                                            @Param("excludedLockId") UUID excludedLockId);

    @Query("""
           SELECT new com.bookati.reservation.domain.repository.LockedCapacity(l.slotId, SUM(l.reservedCapacity))
           FROM ReservationLock l
           WHERE l.slotId IN :slotIds AND l.expiresAt > :now
           GROUP BY l.slotId
           """)
    List<LockedCapacity> sumActiveReservedCapacityBySlot(@Param("slotIds") Collection<UUID> slotIds,
                                                         @Param("now") LocalDateTime now);

    @Query("SELECT l FROM ReservationLock l WHERE l.slotId IN :slotIds AND l.expiresAt > :now ORDER BY l.expiresAt")
    List<ReservationLock> findActiveBySlotIds(@Param("slotIds") Collection<UUID> slotIds,
                                              @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM ReservationLock l WHERE l.id = :id AND l.sessionId = :sessionId")
    int deleteByIdAndSessionId(@Param("id") UUID id, @Param("sessionId") String sessionId);

    @Modifying
    @Query("DELETE FROM ReservationLock l WHERE l.expiresAt <= :before")
    int deleteExpiredBefore(@Param("before") LocalDateTime before);
}
