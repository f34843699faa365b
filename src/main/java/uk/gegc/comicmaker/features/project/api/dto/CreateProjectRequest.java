package uk.gegc.comicmaker.features.project.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;

@Schema(name = "CreateProjectRequest", description = "Payload for creating a comic project")
public record CreateProjectRequest(
        @Schema(description = "Project title", example = "The Lighthouse Keeper", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Title is required")
        @Size(max = 200, message = "Title must not exceed 200 characters")
        String title,

        @Schema(description = "Optional description")
        @Size(max = 2000, message = "Description must not exceed 2000 characters")
        String description,

        @Schema(description = "Art style and language")
        ProjectConfig config
) {}
