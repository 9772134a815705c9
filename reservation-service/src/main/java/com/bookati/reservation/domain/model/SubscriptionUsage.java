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
 * Balance of one service inside one subscription. {@code used + remaining == original} always holds.
 */
@Entity
@Table(name = "subscription_usage", uniqueConstraints = {
        @UniqueConstraint(name = "uq_subscription_usage_service", columnNames = {"subscription_id", "service_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionUsage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "subscription_id", nullable = false)
    private UUID subscriptionId;

    @Column(name = "service_id", nullable = false)
    private UUID serviceId;

    @Column(name = "original_quantity", nullable = false)
    private Integer originalQuantity;

    @Column(name = "used_quantity", nullable = false)
    private Integer usedQuantity;

    @Column(name = "remaining_quantity", nullable = false)
    private Integer remainingQuantity;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Returns up to {@code quantity} units, bounded by what was actually used.
     *
     * @return units credited
     */
    public int credit(int quantity, LocalDateTime now) {
        int credited = Math.min(quantity, usedQuantity);
        this.usedQuantity -= credited;
        this.remainingQuantity += credited;
        this.updatedAt = now;
        return credited;
    }
}
