package com.bookati.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "package_exhaustion_notices", uniqueConstraints = {
        @UniqueConstraint(name = "uq_package_exhaustion_notice", columnNames = {"subscription_id", "service_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageExhaustionNotice {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "subscription_id", nullable = false)
    private UUID subscriptionId;

    @Column(name = "service_id", nullable = false)
    private UUID serviceId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
