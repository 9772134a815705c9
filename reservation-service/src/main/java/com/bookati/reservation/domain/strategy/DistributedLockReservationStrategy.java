package com.bookati.reservation.domain.strategy;

import com.bookati.common.exception.BusinessException;
import com.bookati.common.exception.ServiceUnavailableException;
import com.bookati.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Reservation strategy using distributed lock (Redis/Redisson) + the guarded UPDATE.
 *
 * The Redis lock keeps instances from piling onto the same slot row; the UPDATE guard
 * remains the authority on capacity, so a lock that lapses early can not cause overbooking.
 * Only registered when selected, since it needs a reachable Redis.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "reservation.capacity.strategy", havingValue = "distributed")
@RequiredArgsConstructor
public class DistributedLockReservationStrategy implements CapacityReservationStrategy {

    private final AtomicUpdateReservationStrategy atomicUpdate;
    private final RedissonClient redissonClient;

    @Override
    @Transactional
    public void reserve(UUID slotId, int quantity, int heldElsewhere) {
        String lockKey = Constants.LOCK_PREFIX + slotId;
        RLock lock = redissonClient.getLock(lockKey);

        try {
            // wait max 3 seconds, hold for 30 seconds
            boolean acquired = lock.tryLock(3, 30, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ServiceUnavailableException("Slot " + slotId + " is busy. Please try again.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            atomicUpdate.reserve(slotId, quantity, heldElsewhere);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Reservation interrupted", e, "RESERVATION_INTERRUPTED");
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
