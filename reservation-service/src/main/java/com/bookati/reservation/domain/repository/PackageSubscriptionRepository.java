package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.PackageSubscription;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PackageSubscriptionRepository extends JpaRepository<PackageSubscription, UUID> {
}
