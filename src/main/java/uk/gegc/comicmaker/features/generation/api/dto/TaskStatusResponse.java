package uk.gegc.comicmaker.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "TaskStatusResponse", description = "Job status; {\"status\":\"not_found\"} for unknown ids")
public record TaskStatusResponse(
        @Schema(example = "processing")
        String status,
        Integer progress,
        String error
) {
}
