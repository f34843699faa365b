package uk.gegc.comicmaker.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One purchase attempt. Amounts are integer minor units (paise for INR).
 * Status changes after creation go through the conditional updates in
 * {@code PaymentRepository}, which refuse to touch a terminal row.
 */
@Entity
@Table(name = "payments", uniqueConstraints = {
        @UniqueConstraint(name = "uk_payments_order_id", columnNames = "order_id")
})
@Getter
@Setter
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "order_id", nullable = false, updatable = false, length = 64)
    private String orderId;

    @Column(name = "gateway_payment_id", length = 64)
    private String gatewayPaymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan", nullable = false, updatable = false, length = 16)
    private PlanTier plan;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "currency", nullable = false, updatable = false, length = 10)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "receipt", length = 64)
    private String receipt;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "captured_at")
    private LocalDateTime capturedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = PaymentStatus.CREATED;
        }
        updatedAt = createdAt;
    }
}
