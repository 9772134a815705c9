package com.bookati.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Booking of {@code visitorCount} visitors on one slot. The visitor count is split into a
 * package-covered part and a paid part; only the paid part is priced.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_slot", columnList = "slot_id"),
        @Index(name = "idx_bookings_group", columnList = "booking_group_id"),
        @Index(name = "idx_bookings_tenant_created", columnList = "tenant_id,created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "service_id", nullable = false)
    private UUID serviceId;

    @Column(name = "slot_id", nullable = false)
    private UUID slotId;

    @Column(name = "employee_id")
    private UUID employeeId;

    @Column(name = "customer_id")
    private UUID customerId;

    @Column(name = "customer_name", nullable = false, length = 200)
    private String customerName;

    @Column(name = "customer_phone", nullable = false, length = 32)
    private String customerPhone;

    @Column(name = "customer_email", length = 254)
    private String customerEmail;

    @Column(name = "visitor_count", nullable = false)
    private Integer visitorCount;

    @Column(name = "adult_count", nullable = false)
    private Integer adultCount;

    @Column(name = "child_count", nullable = false)
    private Integer childCount;

    @Column(name = "package_covered_quantity", nullable = false)
    private Integer packageCoveredQuantity;

    @Column(name = "paid_quantity", nullable = false)
    private Integer paidQuantity;

    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "booking_group_id")
    private UUID bookingGroupId;

    @Column(name = "package_subscription_id")
    private UUID packageSubscriptionId;

    @Column(name = "offer_id")
    private UUID offerId;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "language", nullable = false, length = 2)
    private String language;

    @Column(name = "ticket_token", length = 64)
    private String ticketToken;

    @Column(name = "qr_scanned", nullable = false)
    private boolean qrScanned;

    @Column(name = "checked_in_at")
    private LocalDateTime checkedInAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Services stamp both timestamps from the business clock; this only fills what they left unset.
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = BookingStatus.CONFIRMED;
        }
        if (paymentStatus == null) {
            paymentStatus = PaymentStatus.UNPAID;
        }
        if (language == null) {
            language = "en";
        }
    }

    /**
     * Whether the booking still occupies capacity on its slot.
     */
    public boolean holdsCapacity() {
        return status == BookingStatus.PENDING || status == BookingStatus.CONFIRMED;
    }

    public boolean isPaymentCollected() {
        return paymentStatus == PaymentStatus.PAID || paymentStatus == PaymentStatus.PAID_MANUAL;
    }

    public enum BookingStatus {
        PENDING,
        CONFIRMED,
        CHECKED_IN,
        COMPLETED,
        CANCELLED
    }

    public enum PaymentStatus {
        UNPAID,
        AWAITING_PAYMENT,
        PAID,
        PAID_MANUAL,
        REFUNDED
    }

    /**
     * Recorded when staff take the payment at the desk.
     */
    public enum PaymentMethod {
        CASH,
        CARD,
        BANK_TRANSFER
    }
}
