package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.ServiceOffering;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, UUID> {
}
