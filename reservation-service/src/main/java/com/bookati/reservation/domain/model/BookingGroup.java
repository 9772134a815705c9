package com.bookati.reservation.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One row per bulk booking. The primary key is the booking group id itself, so a second
 * insert with the same caller-supplied id fails on the constraint instead of re-running the bulk.
 * Always inserted, never merged.
 */
@Entity
@Table(name = "booking_groups")
@Getter
@NoArgsConstructor
public class BookingGroup implements Persistable<UUID> {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Transient
    private boolean newEntity = true;

    public BookingGroup(UUID id, UUID tenantId, LocalDateTime createdAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.createdAt = createdAt;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
