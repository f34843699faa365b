package uk.gegc.comicmaker.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

@Schema(name = "CreateOrderRequest", description = "Request to create a payment order for a plan upgrade")
public record CreateOrderRequest(
        @Schema(description = "Plan to purchase", example = "PRO", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Plan is required")
        PlanTier plan
) {}
