package com.bookati.reservation.api.dto;

import com.bookati.reservation.domain.model.BookingAuditLog;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;
import java.util.UUID;

public record BookingAuditEntryResponse(
        UUID id,
        UUID bookingId,
        BookingAuditLog.AuditAction action,
        JsonNode oldValues,
        JsonNode newValues,
        LocalDateTime createdAt
) {
}
