package com.bookati.reservation.api.controller;

import com.bookati.common.dto.BaseResponse;
import com.bookati.reservation.api.dto.LockResponse;
import com.bookati.reservation.api.dto.SlotAvailabilityResponse;
import com.bookati.reservation.domain.service.ReservationLockService;
import com.bookati.reservation.domain.service.SlotCapacityService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/slots")
@RequiredArgsConstructor
public class SlotController {

    private final SlotCapacityService slotCapacityService;
    private final ReservationLockService lockService;

    @GetMapping("/availability")
    public ResponseEntity<BaseResponse<List<SlotAvailabilityResponse>>> availability(
            @RequestParam List<UUID> slotIds) {
        return ResponseEntity.ok(BaseResponse.success(slotCapacityService.effectiveCapacity(slotIds)));
    }

    @GetMapping("/locks")
    public ResponseEntity<BaseResponse<List<LockResponse>>> activeLocks(@RequestParam List<UUID> slotIds) {
        return ResponseEntity.ok(BaseResponse.success(lockService.activeLocks(slotIds)));
    }
}
