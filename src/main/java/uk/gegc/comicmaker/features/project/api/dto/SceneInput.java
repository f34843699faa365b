package uk.gegc.comicmaker.features.project.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.comicmaker.features.project.domain.model.NarrativeText;

@Schema(name = "SceneInput", description = "One panel to create or replace")
public record SceneInput(
        @Schema(description = "Page number, starting at 1", example = "1")
        @Min(value = 1, message = "Page number must be at least 1")
        int pageNo,

        @Schema(description = "Panel number within the page", example = "1", minimum = "1", maximum = "4")
        @Min(value = 1, message = "Panel number must be between 1 and 4")
        @Max(value = 4, message = "Panel number must be between 1 and 4")
        int panelNo,

        @NotNull(message = "Narrative text is required")
        @Valid
        NarrativeText narrativeText,

        @Size(max = 32)
        String language
) {}
