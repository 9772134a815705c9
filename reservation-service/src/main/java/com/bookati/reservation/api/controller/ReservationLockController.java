package com.bookati.reservation.api.controller;

import com.bookati.common.dto.BaseResponse;
import com.bookati.reservation.api.dto.AcquireLockRequest;
import com.bookati.reservation.api.dto.LockResponse;
import com.bookati.reservation.api.dto.LockValidationResponse;
import com.bookati.reservation.domain.service.ReservationLockService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Checkout holds polled by the booking UI.
 */
@RestController
@RequestMapping("/api/v1/reservation-locks")
@RequiredArgsConstructor
public class ReservationLockController {

    private final ReservationLockService lockService;

    @PostMapping
    public ResponseEntity<BaseResponse<LockResponse>> acquire(@Valid @RequestBody AcquireLockRequest request) {
        LockResponse response = lockService.acquire(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Lock acquired", response));
    }

    /**
     * 200 while the lock is usable, 409 with the same body once it is not.
     */
    @GetMapping("/{lockId}")
    public ResponseEntity<BaseResponse<LockValidationResponse>> validate(
            @PathVariable UUID lockId,
            @RequestParam String sessionId) {
        LockValidationResponse response = lockService.validate(lockId, sessionId);
        if (!response.valid()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(BaseResponse.error("Lock is no longer valid", "LOCK_INVALID", response));
        }
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @DeleteMapping("/{lockId}")
    public ResponseEntity<BaseResponse<Void>> release(
            @PathVariable UUID lockId,
            @RequestParam String sessionId) {
        lockService.release(lockId, sessionId);
        return ResponseEntity.ok(BaseResponse.success("Lock released", null));
    }
}
