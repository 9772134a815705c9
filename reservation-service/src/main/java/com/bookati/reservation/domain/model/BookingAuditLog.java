package com.bookati.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Before and after values of one booking change. Rows are written with the change and never updated.
 */
@Entity
@Table(name = "booking_audit_log", indexes = {
        @Index(name = "idx_booking_audit_log_booking", columnList = "booking_id,created_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "booking_id", nullable = false)
    private UUID bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 32)
    private AuditAction action;

    @Column(name = "old_values", columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String oldValues;

    @Column(name = "new_values", columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String newValues;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public enum AuditAction {
        STATUS_CHANGED,
        PAYMENT_STATUS_CHANGED,
        MARKED_PAID,
        CHECKED_IN,
        RESCHEDULED,
        CANCELLED,
        DELETED
    }
}
