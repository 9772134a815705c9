package com.bookati.reservation.api.controller;

import com.bookati.common.dto.BaseResponse;
import com.bookati.common.util.Constants;
import com.bookati.reservation.api.dto.BookingAuditEntryResponse;
import com.bookati.reservation.api.dto.BookingResponse;
import com.bookati.reservation.api.dto.BulkBookingResponse;
import com.bookati.reservation.api.dto.CheckInRequest;
import com.bookati.reservation.api.dto.CreateBookingRequest;
import com.bookati.reservation.api.dto.CreateBulkBookingRequest;
import com.bookati.reservation.api.dto.MarkPaidRequest;
import com.bookati.reservation.api.dto.RescheduleRequest;
import com.bookati.reservation.api.dto.RescheduleResponse;
import com.bookati.reservation.api.dto.UpdatePaymentStatusRequest;
import com.bookati.reservation.api.dto.UpdateStatusRequest;
import com.bookati.reservation.domain.service.BookingAuditService;
import com.bookati.reservation.domain.service.BookingCancellationService;
import com.bookati.reservation.domain.service.BookingService;
import com.bookati.reservation.domain.service.BookingTransactionEngine;
import com.bookati.reservation.domain.service.RescheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Booking creation and lifecycle. Operations on an existing booking take the caller's tenant
 * from the X-Tenant-Id header.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingTransactionEngine bookingEngine;
    private final RescheduleService rescheduleService;
    private final BookingCancellationService cancellationService;
    private final BookingService bookingService;
    private final BookingAuditService auditService;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = bookingEngine.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", response));
    }

    @PostMapping("/bulk")
    public ResponseEntity<BaseResponse<BulkBookingResponse>> createBulkBooking(
            @Valid @RequestBody CreateBulkBookingRequest request) {
        BulkBookingResponse response = bookingEngine.createBulk(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Bulk booking created successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBooking(tenantId, id)));
    }

    @GetMapping("/groups/{groupId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookingGroup(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID groupId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getGroup(tenantId, groupId)));
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<BaseResponse<List<BookingAuditEntryResponse>>> getAuditTrail(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(auditService.history(tenantId, id)));
    }

    @PatchMapping("/{id}/slot")
    public ResponseEntity<BaseResponse<RescheduleResponse>> reschedule(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id,
            @Valid @RequestBody RescheduleRequest request) {
        RescheduleResponse response = rescheduleService.moveBooking(tenantId, id, request.newSlotId());
        return ResponseEntity.ok(BaseResponse.success("Booking rescheduled successfully", response));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<BaseResponse<BookingResponse>> updateStatus(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id,
            @Valid @RequestBody UpdateStatusRequest request) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.updateStatus(tenantId, id, request.status())));
    }

    @PatchMapping("/{id}/payment-status")
    public ResponseEntity<BaseResponse<BookingResponse>> updatePaymentStatus(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id,
            @Valid @RequestBody UpdatePaymentStatusRequest request) {
        return ResponseEntity.ok(BaseResponse.success(
                bookingService.updatePaymentStatus(tenantId, id, request.paymentStatus())));
    }

    @PostMapping("/{id}/mark-paid")
    public ResponseEntity<BaseResponse<BookingResponse>> markPaid(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id,
            @RequestBody(required = false) MarkPaidRequest request) {
        BookingResponse response = bookingService.markPaid(tenantId, id, request == null ? null : request.paymentMethod());
        return ResponseEntity.ok(BaseResponse.success("Booking marked as paid", response));
    }

    @PostMapping("/check-in")
    public ResponseEntity<BaseResponse<BookingResponse>> checkIn(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody CheckInRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Checked in", bookingService.checkIn(tenantId, request.ticketToken())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancel(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled", cancellationService.cancel(tenantId, id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BaseResponse<Void>> delete(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean allowDeletePaid) {
        cancellationService.delete(tenantId, id, allowDeletePaid);
        return ResponseEntity.ok(BaseResponse.success("Booking deleted", null));
    }
}
