package uk.gegc.comicmaker.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "PdfRequest")
public record PdfRequest(
        @Schema(description = "Rebuild even if a PDF already exists", defaultValue = "false")
        Boolean forceRegenerate
) {

    public boolean force() {
        return Boolean.TRUE.equals(forceRegenerate);
    }
}
