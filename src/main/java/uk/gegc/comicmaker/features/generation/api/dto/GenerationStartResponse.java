package uk.gegc.comicmaker.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "GenerationStartResponse", description = "Acknowledgement of a queued job")
public record GenerationStartResponse(
        @Schema(description = "Always \"queued\"", example = "queued")
        String status,
        @Schema(description = "Job id to poll")
        String taskId,
        UUID generationId
) {

    public static GenerationStartResponse queued(String taskId, UUID generationId) {
        return new GenerationStartResponse("queued", taskId, generationId);
    }
}
