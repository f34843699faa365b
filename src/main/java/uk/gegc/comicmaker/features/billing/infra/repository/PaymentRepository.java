package uk.gegc.comicmaker.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.comicmaker.features.billing.domain.model.Payment;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    Optional<Payment> findByOrderId(String orderId);

    Optional<Payment> findByOrderIdAndUserId(String orderId, UUID userId);

    /**
     * CREATED/PENDING to SUCCESS. A terminal row is left untouched.
     *
     * @return 1 if the transition happened, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Payment p
        SET p.status = uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus.SUCCESS,
            p.gatewayPaymentId = :gatewayPaymentId,
            p.capturedAt = :capturedAt,
            p.updatedAt = :capturedAt
        WHERE p.id = :id
          AND p.status IN (uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus.CREATED,
                           uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus.PENDING)
    """)
    int markCaptured(@Param("id") UUID id,
                     @Param("gatewayPaymentId") String gatewayPaymentId,
                     @Param("capturedAt") LocalDateTime capturedAt);

    /**
     * CREATED/PENDING to FAILED. A terminal row is left untouched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Payment p
        SET p.status = uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus.FAILED,
            p.gatewayPaymentId = :gatewayPaymentId,
            p.failureReason = :reason,
            p.updatedAt = :now
        WHERE p.id = :id
          AND p.status IN (uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus.CREATED,
                           uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus.PENDING)
    """)
    int markFailed(@Param("id") UUID id,
                   @Param("gatewayPaymentId") String gatewayPaymentId,
                   @Param("reason") String reason,
                   @Param("now") LocalDateTime now);
}
