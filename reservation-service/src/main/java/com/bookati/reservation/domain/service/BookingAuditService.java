package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.reservation.api.dto.BookingAuditEntryResponse;
import com.bookati.reservation.domain.model.Booking;
import com.bookati.reservation.domain.model.BookingAuditLog;
import com.bookati.reservation.domain.model.BookingAuditLog.AuditAction;
import com.bookati.reservation.domain.repository.BookingAuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Audit trail of booking changes. Entries join the transaction of the change they describe,
 * so a rolled-back change leaves no entry and a committed one always has one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingAuditService {

    private final BookingAuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(Booking booking, AuditAction action, Map<String, Object> oldValues,
                       Map<String, Object> newValues) {
        auditLogRepository.save(BookingAuditLog.builder()
                .tenantId(booking.getTenantId())
                .bookingId(booking.getId())
                .action(action)
                .oldValues(toJson(oldValues))
                .newValues(toJson(newValues))
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.debug("Audited {} on booking {}", action, booking.getId());
    }

    /**
     * Entries of one booking, oldest first. Still readable after the booking was deleted.
     */
    @Transactional(readOnly = true)
    public List<BookingAuditEntryResponse> history(UUID tenantId, UUID bookingId) {
        List<BookingAuditEntryResponse> entries = auditLogRepository.findByBookingIdOrderByCreatedAtAsc(bookingId)
                .stream()
                .filter(entry -> entry.getTenantId().equals(tenantId))
                .map(this::toResponse)
                .collect(Collectors.toList());
        if (entries.isEmpty()) {
            throw new ResourceNotFoundException("Audit trail of booking", bookingId);
        }
        return entries;
    }

    /**
     * Fields a reader needs to tell what a booking looked like before it was cancelled or removed.
     */
    static Map<String, Object> snapshot(Booking booking) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("slotId", booking.getSlotId());
        values.put("employeeId", booking.getEmployeeId());
        values.put("customerName", booking.getCustomerName());
        values.put("customerPhone", booking.getCustomerPhone());
        values.put("visitorCount", booking.getVisitorCount());
        values.put("packageCoveredQuantity", booking.getPackageCoveredQuantity());
        values.put("paidQuantity", booking.getPaidQuantity());
        values.put("totalPrice", booking.getTotalPrice());
        values.put("status", booking.getStatus());
        values.put("paymentStatus", booking.getPaymentStatus());
        values.put("paymentMethod", booking.getPaymentMethod());
        values.put("packageSubscriptionId", booking.getPackageSubscriptionId());
        return values;
    }

    static Map<String, Object> values(String key, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(key, value);
        return values;
    }

    private String toJson(Map<String, Object> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit values", e);
        }
    }

    private BookingAuditEntryResponse toResponse(BookingAuditLog entry) {
        try {
            return new BookingAuditEntryResponse(entry.getId(), entry.getBookingId(), entry.getAction(),
                    objectMapper.readTree(entry.getOldValues()), objectMapper.readTree(entry.getNewValues()),
                    entry.getCreatedAt());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit entry " + entry.getId() + " holds malformed JSON", e);
        }
    }
}
