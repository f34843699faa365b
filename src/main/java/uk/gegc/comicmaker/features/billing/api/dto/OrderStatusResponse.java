package uk.gegc.comicmaker.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.time.LocalDateTime;

@Schema(name = "OrderStatusResponse", description = "Current state of a payment order")
public record OrderStatusResponse(
        String orderId,
        PlanTier plan,
        long amount,
        String currency,
        PaymentStatus status,
        String failureReason,
        LocalDateTime createdAt,
        LocalDateTime capturedAt
) {}
