package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.BookingAuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BookingAuditLogRepository extends JpaRepository<BookingAuditLog, UUID> {

    List<BookingAuditLog> findByBookingIdOrderByCreatedAtAsc(UUID bookingId);
}
