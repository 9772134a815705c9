package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {
}
