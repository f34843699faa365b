package uk.gegc.comicmaker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.AccountStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "AuthenticatedUserDto", description = "The current user with plan and quota state")
public record AuthenticatedUserDto(
        UUID id,
        String username,
        String email,
        PlanTier plan,
        AccountStatus accountStatus,
        int monthlyQuota,
        int quotaUsed,
        LocalDateTime quotaResetAt,
        boolean freeStoryAvailable,
        boolean freeStoryUsed,
        LocalDateTime createdAt
) {
}
