package uk.gegc.comicmaker.features.project.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "UpsertScenesRequest", description = "Panels keyed by (page, panel); existing panels are replaced")
public record UpsertScenesRequest(
        @NotEmpty(message = "At least one scene is required")
        List<@Valid SceneInput> scenes
) {}
