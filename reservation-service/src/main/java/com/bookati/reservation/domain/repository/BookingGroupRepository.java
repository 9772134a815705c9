package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.BookingGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface BookingGroupRepository extends JpaRepository<BookingGroup, UUID> {
}
