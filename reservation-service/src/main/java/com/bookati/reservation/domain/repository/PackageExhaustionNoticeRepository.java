package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.PackageExhaustionNotice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PackageExhaustionNoticeRepository extends JpaRepository<PackageExhaustionNotice, UUID> {

    boolean existsBySubscriptionIdAndServiceId(UUID subscriptionId, UUID serviceId);
}
