package com.bookati.reservation.domain.repository;

import com.bookati.reservation.domain.model.PackageSubscription;
import com.bookati.reservation.domain.model.SubscriptionUsage;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionUsageRepository extends JpaRepository<SubscriptionUsage, UUID> {

    /**
     * Balances for a service across the customer's usable subscriptions: active status,
     * active flag set, not expired, and something left.
     */
    @Query("""
           SELECT new com.bookati.reservation.domain.repository.SubscriptionBalance(
                   u.subscriptionId, u.id, u.remainingQuantity)
           FROM SubscriptionUsage u, PackageSubscription s
           WHERE u.subscriptionId = s.id
             AND s.tenantId = :tenantId
             AND s.customerId = :customerId
             AND u.serviceId = :serviceId
             AND s.status = :status
             AND s.active = true
             AND (s.expiresAt IS NULL OR s.expiresAt > :now)
             AND u.remainingQuantity > 0
           """)
    List<SubscriptionBalance> findUsableBalances(@Param("tenantId") UUID tenantId,
                                                 @Param("customerId") UUID customerId,
                                                 @Param("serviceId") UUID serviceId,
                                                 @Param("status") PackageSubscription.SubscriptionStatus status,
                                                 @Param("now") LocalDateTime now);

    /**
     * Atomically debits a usage row. Returns 0 when the remaining balance no longer covers {@code quantity}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE SubscriptionUsage u
           SET u.usedQuantity = u.usedQuantity + :quantity,
               u.remainingQuantity = u.remainingQuantity - :quantity,
               u.updatedAt = :now
           WHERE u.id = :id
             AND u.remainingQuantity >= :quantity
           """)
    int debitAtomically(@Param("id") UUID id,
                        @Param("quantity") int quantity,
                        @Param("now") LocalDateTime now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM SubscriptionUsage u WHERE u.subscriptionId = :subscriptionId AND u.serviceId = :serviceId")
    Optional<SubscriptionUsage> findForUpdate(@Param("subscriptionId") UUID subscriptionId,
                                              @Param("serviceId") UUID serviceId);
}
