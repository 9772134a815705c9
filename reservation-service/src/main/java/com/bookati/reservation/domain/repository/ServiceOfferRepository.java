package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.ServiceOffer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ServiceOfferRepository extends JpaRepository<ServiceOffer, UUID> {
}
