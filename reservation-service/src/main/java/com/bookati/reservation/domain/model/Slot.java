package com.bookati.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * A bookable, capacity-bearing interval of a service, usually tied to one employee's shift.
 * Rows are generated elsewhere; this service only moves capacity between
 * {@code availableCapacity} and {@code bookedCount}, keeping their sum equal to {@code originalCapacity}.
 */
@Entity
@Table(name = "slots", indexes = {
        @Index(name = "idx_slots_service_date", columnList = "service_id,slot_date")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Slot {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "service_id", nullable = false)
    private UUID serviceId;

    @Column(name = "employee_id")
    private UUID employeeId;

    @Column(name = "shift_id")
    private UUID shiftId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "original_capacity", nullable = false, updatable = false)
    private Integer originalCapacity;

    @Column(name = "available_capacity", nullable = false)
    private Integer availableCapacity;

    @Column(name = "booked_count", nullable = false)
    private Integer bookedCount;

    @Column(name = "is_available", nullable = false)
    private boolean available;

    public LocalDateTime startsAt() {
        return LocalDateTime.of(slotDate, startTime);
    }

    /**
     * Moves capacity from available to booked. Only safe on a row held under a write lock.
     */
    public void reserve(int quantity) {
        if (this.availableCapacity < quantity) {
            throw new IllegalStateException("Insufficient slot capacity");
        }
        this.availableCapacity -= quantity;
        this.bookedCount += quantity;
    }

    /**
     * Gives capacity back, never exceeding the original capacity.
     */
    public void release(int quantity) {
        this.availableCapacity = Math.min(originalCapacity, availableCapacity + quantity);
        this.bookedCount = originalCapacity - availableCapacity;
    }
}
