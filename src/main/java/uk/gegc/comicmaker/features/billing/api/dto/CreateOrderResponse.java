package uk.gegc.comicmaker.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

@Schema(name = "CreateOrderResponse", description = "Gateway order the client completes checkout against")
public record CreateOrderResponse(
        @Schema(description = "Gateway order id", example = "order_Nz8n3kQp1XyZ")
        String orderId,

        @Schema(description = "Amount in minor units", example = "9900")
        long amount,

        @Schema(description = "ISO currency code", example = "INR")
        String currency,

        @Schema(description = "Public gateway key id for the checkout widget")
        String keyId,

        PlanTier plan
) {}
