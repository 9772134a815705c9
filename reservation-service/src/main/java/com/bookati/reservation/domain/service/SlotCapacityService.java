package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ForbiddenException;
import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.common.exception.ValidationException;
import com.bookati.reservation.api.dto.SlotAvailabilityResponse;
import com.bookati.reservation.domain.exception.SlotUnavailableException;
import com.bookati.reservation.domain.model.Slot;
import com.bookati.reservation.domain.repository.LockedCapacity;
import com.bookati.reservation.domain.repository.ReservationLockRepository;
import com.bookati.reservation.domain.repository.SlotRepository;
import com.bookati.reservation.domain.strategy.CapacityReservationStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Slot capacity store. The only place slot capacity is taken or given back.
 *
 * Reservation goes through a {@link CapacityReservationStrategy} picked by bean name:
 * - atomic: guarded UPDATE (default)
 * - pessimistic: SELECT FOR UPDATE
 * - distributed: Redisson lock around the guarded UPDATE
 *
 * Configuration:
 * reservation.capacity.strategy: atomic | pessimistic | distributed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotCapacityService {

    private static final String DEFAULT_STRATEGY = "atomic";

    private final Map<String, CapacityReservationStrategy> reservationStrategies;
    private final SlotRepository slotRepository;
    private final ReservationLockRepository reservationLockRepository;
    private final Clock clock;

    @Value("${reservation.capacity.strategy:atomic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        CapacityReservationStrategy strategy = getReservationStrategy();
        log.info("Initialized SlotCapacityService with strategy: {}", strategy.getStrategyType());
    }

    /**
     * Takes {@code quantity} from the slot, leaving {@code heldElsewhere} for other checkout sessions.
     * Joins the caller's transaction.
     */
    @Transactional
    public void reserve(UUID slotId, int quantity, int heldElsewhere) {
        if (quantity < 1) {
            throw new ValidationException("Quantity to reserve must be at least 1");
        }
        CapacityReservationStrategy strategy = getReservationStrategy();
        log.debug("Reserving {} on slot {} using strategy: {}", quantity, slotId, strategy.getStrategyType());
        strategy.reserve(slotId, quantity, Math.max(heldElsewhere, 0));
    }

    /**
     * Gives capacity back, clamped at the original capacity. A missing slot is logged and skipped.
     */
    @Transactional
    public void release(UUID slotId, int quantity) {
        if (quantity < 1) {
            return;
        }
        int updated = slotRepository.releaseAtomically(slotId, quantity);
        if (updated == 0) {
            log.warn("Release of {} skipped: slot {} not found", quantity, slotId);
            return;
        }
        log.debug("Released {} on slot {}", quantity, slotId);
    }

    /**
     * Loads a slot for booking and checks tenant, service and start time. Availability and
     * capacity are left to {@link #reserve}, which checks them under the row lock.
     */
    @Transactional(readOnly = true)
    public Slot requireBookableSlot(UUID slotId, UUID tenantId, UUID serviceId) {
        Slot slot = slotRepository.findById(slotId)
                .orElseThrow(() -> new ResourceNotFoundException("Slot", slotId));
        if (!slot.getTenantId().equals(tenantId)) {
            throw new ForbiddenException("Slot " + slotId + " belongs to another tenant", "TENANT_MISMATCH");
        }
        if (!slot.getServiceId().equals(serviceId)) {
            throw new ValidationException("Slot " + slotId + " is not a slot of service " + serviceId,
                    "SERVICE_MISMATCH");
        }
        if (slot.startsAt().isBefore(LocalDateTime.now(clock))) {
            throw new ValidationException("Slot " + slotId + " starts in the past", "SLOT_IN_PAST");
        }
        return slot;
    }

    /**
     * {@link #requireBookableSlot} plus the availability flag, for pre-checks that want to fail
     * before anything is written.
     */
    @Transactional(readOnly = true)
    public Slot verifyBookable(UUID slotId, UUID tenantId, UUID serviceId) {
        Slot slot = requireBookableSlot(slotId, tenantId, serviceId);
        if (!slot.isAvailable()) {
            throw new SlotUnavailableException(slotId);
        }
        return slot;
    }

    @Transactional(readOnly = true)
    public List<SlotAvailabilityResponse> effectiveCapacity(Collection<UUID> slotIds) {
        LinkedHashSet<UUID> distinct = new LinkedHashSet<>(slotIds);
        if (distinct.isEmpty()) {
            return List.of();
        }

        Map<UUID, Slot> slots = slotRepository.findAllById(distinct).stream()
                .collect(Collectors.toMap(Slot::getId, slot -> slot));
        Map<UUID, Long> locked = new HashMap<>();
        for (LockedCapacity row : reservationLockRepository.sumActiveReservedCapacityBySlot(
                distinct, LocalDateTime.now(clock))) {
            locked.put(row.slotId(), row.lockedCapacity());
        }

        return distinct.stream()
                .map(id -> {
                    Slot slot = slots.get(id);
                    if (slot == null) {
                        throw new ResourceNotFoundException("Slot", id);
                    }
                    int held = locked.getOrDefault(id, 0L).intValue();
                    int effective = slot.isAvailable() ? Math.max(slot.getAvailableCapacity() - held, 0) : 0;
                    return new SlotAvailabilityResponse(id, slot.isAvailable(),
                            slot.getAvailableCapacity(), held, effective);
                })
                .collect(Collectors.toList());
    }

    /**
     * Looks the strategy up by bean name, falling back to atomic for unknown values.
     */
    private CapacityReservationStrategy getReservationStrategy() {
        String strategyKey = strategyType.toLowerCase();
        CapacityReservationStrategy strategy = reservationStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, reservationStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = reservationStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(
                        "atomic strategy not found. Available strategies: " + reservationStrategies.keySet());
            }
        }
        return strategy;
    }
}
