package com.bookati.reservation.api.controller;

import com.bookati.common.dto.BaseResponse;
import com.bookati.common.util.Constants;
import com.bookati.reservation.api.dto.PackageCoverageResponse;
import com.bookati.reservation.domain.service.PackageCapacityResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Preview of package coverage for the booking form. Nothing is debited.
 * A quantity below 1 is rejected by the resolver.
 */
@RestController
@RequestMapping("/api/v1/packages")
@RequiredArgsConstructor
public class PackageCoverageController {

    private final PackageCapacityResolver packageResolver;

    @GetMapping("/coverage")
    public ResponseEntity<BaseResponse<PackageCoverageResponse>> coverage(
            @RequestHeader(Constants.TENANT_HEADER) UUID tenantId,
            @RequestParam(required = false) UUID customerId,
            @RequestParam UUID serviceId,
            @RequestParam(defaultValue = "1") int quantity) {
        return ResponseEntity.ok(BaseResponse.success(PackageCoverageResponse.from(
                packageResolver.resolve(tenantId, customerId, serviceId, quantity))));
    }
}
