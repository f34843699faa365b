package uk.gegc.comicmaker.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.comicmaker.features.asset.api.dto.PdfAssetDto;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "PdfStatusResponse", description = "Latest PDF job and the compiled asset when available")
public record PdfStatusResponse(
        String status,
        Integer progress,
        String error,
        String taskId,
        PdfAssetDto pdf
) {
}
