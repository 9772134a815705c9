package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.common.util.Constants;
import com.bookati.reservation.api.dto.AcquireLockRequest;
import com.bookati.reservation.api.dto.LockResponse;
import com.bookati.reservation.api.dto.LockValidationResponse;
import com.bookati.reservation.domain.exception.CapacityExhaustedException;
import com.bookati.reservation.domain.exception.LockInvalidException;
import com.bookati.reservation.domain.exception.SlotUnavailableException;
import com.bookati.reservation.domain.model.ReservationLock;
import com.bookati.reservation.domain.model.Slot;
import com.bookati.reservation.domain.repository.ReservationLockRepository;
import com.bookati.reservation.domain.repository.SlotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Advisory checkout holds. A lock never changes slot capacity and never takes a row lock;
 * its only effect is that other sessions see less effective capacity until it expires.
 * Expired locks are ignored by every query, the purge job only keeps the table small.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationLockService {

    private final ReservationLockRepository lockRepository;
    private final SlotRepository slotRepository;
    private final Clock clock;

    @Value("${reservation.lock.ttl-seconds:120}")
    private int defaultTtlSeconds;

    @Value("${reservation.lock.max-ttl-seconds:600}")
    private int maxTtlSeconds;

    @Transactional
    public LockResponse acquire(AcquireLockRequest request) {
        UUID slotId = request.slotId();
        int requested = request.reservedCapacity();

        Slot slot = slotRepository.findById(slotId)
                .orElseThrow(() -> new ResourceNotFoundException("Slot", slotId));
        if (!slot.isAvailable()) {
            throw new SlotUnavailableException(slotId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        long held = lockRepository.sumActiveReservedCapacity(slotId, now);
        long effective = Math.max(slot.getAvailableCapacity() - held, 0);
        if (effective < requested) {
            throw new CapacityExhaustedException(String.format(
                    "Not enough capacity available. Only %d available, but %d requested.", effective, requested));
        }

        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? Constants.SESSION_PREFIX + UUID.randomUUID()
                : request.sessionId();

        ReservationLock lock = lockRepository.save(ReservationLock.builder()
                .slotId(slotId)
                .sessionId(sessionId)
                .reservedCapacity(requested)
                .createdAt(now)
                .expiresAt(now.plusSeconds(ttlSeconds(request.ttlSeconds())))
                .build());

        log.info("Acquired reservation lock {} on slot {} for session {} ({} units, expires {})",
                lock.getId(), slotId, sessionId, requested, lock.getExpiresAt());
        return LockResponse.from(lock);
    }

    /**
     * Polled by the checkout UI. Missing, expired and foreign locks all read as invalid.
     */
    @Transactional(readOnly = true)
    public LockValidationResponse validate(UUID lockId, String sessionId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return lockRepository.findById(lockId)
                .filter(lock -> lock.isOwnedBy(sessionId))
                .filter(lock -> !lock.isExpiredAt(now))
                .map(lock -> new LockValidationResponse(true,
                        Math.max(0, Duration.between(now, lock.getExpiresAt()).getSeconds()),
                        lock.getExpiresAt()))
                .orElseGet(LockValidationResponse::invalid);
    }

    @Transactional
    public void release(UUID lockId, String sessionId) {
        int deleted = lockRepository.deleteByIdAndSessionId(lockId, sessionId);
        if (deleted == 0) {
            throw new ResourceNotFoundException("Reservation lock", lockId);
        }
        log.info("Released reservation lock {} for session {}", lockId, sessionId);
    }

    @Transactional(readOnly = true)
    public List<LockResponse> activeLocks(Collection<UUID> slotIds) {
        if (slotIds.isEmpty()) {
            return List.of();
        }
        return lockRepository.findActiveBySlotIds(slotIds, LocalDateTime.now(clock)).stream()
                .map(LockResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Capacity held on the slot by unexpired locks, leaving out {@code excludedLockId} when given.
     */
    @Transactional(readOnly = true)
    public int heldCapacity(UUID slotId, UUID excludedLockId) {
        LocalDateTime now = LocalDateTime.now(clock);
        long held = excludedLockId == null
                ? lockRepository.sumActiveReservedCapacity(slotId, now)
                : lockRepository.sumActiveReservedCapacityExcluding(slotId, now, excludedLockId);
        return (int) held;
    }

    /**
     * Checks that a lock presented with a booking still backs it.
     *
     * @throws LockInvalidException when the lock is missing, expired, foreign, on another slot or too small
     */
    @Transactional(readOnly = true)
    public ReservationLock requireUsableLock(UUID lockId, String sessionId, UUID slotId, int quantity) {
        ReservationLock lock = lockRepository.findById(lockId)
                .orElseThrow(() -> new LockInvalidException("Reservation lock " + lockId + " not found or already released"));
        if (lock.isExpiredAt(LocalDateTime.now(clock))) {
            throw new LockInvalidException("Reservation lock " + lockId + " has expired");
        }
        if (sessionId == null || !lock.isOwnedBy(sessionId)) {
            throw new LockInvalidException("Reservation lock " + lockId + " belongs to another session");
        }
        if (!lock.getSlotId().equals(slotId)) {
            throw new LockInvalidException("Reservation lock " + lockId + " is for another slot");
        }
        if (lock.getReservedCapacity() < quantity) {
            throw new LockInvalidException(String.format(
                    "Reservation lock %s holds %d but %d visitors were requested",
                    lockId, lock.getReservedCapacity(), quantity));
        }
        return lock;
    }

    /**
     * Removes a lock that has been turned into a booking. Runs inside the booking transaction.
     */
    @Transactional
    public void consume(UUID lockId, String sessionId) {
        int deleted = lockRepository.deleteByIdAndSessionId(lockId, sessionId);
        log.debug("Consumed reservation lock {} ({} row)", lockId, deleted);
    }

    @Scheduled(fixedDelayString = "${reservation.lock.cleanup-interval-ms:60000}")
    @Transactional
    public void purgeExpired() {
        int deleted = lockRepository.deleteExpiredBefore(LocalDateTime.now(clock));
        if (deleted > 0) {
            log.info("Purged {} expired reservation locks", deleted);
        }
    }

    private int ttlSeconds(Integer requested) {
        if (requested == null || requested <= 0) {
            return Math.min(defaultTtlSeconds, maxTtlSeconds);
        }
        return Math.min(requested, maxTtlSeconds);
    }
}
