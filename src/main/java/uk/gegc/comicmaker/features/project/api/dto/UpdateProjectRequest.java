package uk.gegc.comicmaker.features.project.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;

@Schema(name = "UpdateProjectRequest", description = "Partial update of a DRAFT project; null fields are left unchanged")
public record UpdateProjectRequest(
        @Size(min = 1, max = 200, message = "Title must be between 1 and 200 characters")
        String title,

        @Size(max = 2000, message = "Description must not exceed 2000 characters")
        String description,

        ProjectConfig config
) {}
