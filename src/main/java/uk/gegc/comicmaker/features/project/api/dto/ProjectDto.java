package uk.gegc.comicmaker.features.project.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "ProjectDto", description = "Comic project")
public record ProjectDto(
        UUID id,
        String title,
        String description,
        ProjectConfig config,
        @Schema(description = "Plan captured when the project was created; governs all limits")
        PlanTier planSnapshot,
        ProjectStatus status,
        int totalPages,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime completedAt
) {}
