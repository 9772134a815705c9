package com.bookati.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Advisory hold placed by a checkout session. It never touches slot capacity;
 * unexpired holds of other sessions are subtracted when computing effective capacity.
 */
@Entity
@Table(name = "reservation_locks", indexes = {
        @Index(name = "idx_reservation_locks_slot_expires", columnList = "slot_id,expires_at"),
        @Index(name = "idx_reservation_locks_expires", columnList = "expires_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationLock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "slot_id", nullable = false)
    private UUID slotId;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(name = "reserved_capacity", nullable = false)
    private Integer reservedCapacity;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isOwnedBy(String session) {
        return sessionId.equals(session);
    }
}
