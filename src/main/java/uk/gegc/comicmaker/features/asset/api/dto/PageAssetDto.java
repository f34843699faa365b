package uk.gegc.comicmaker.features.asset.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.comicmaker.features.comic.domain.model.ImageResolution;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "PageAssetDto", description = "One rendered comic page")
public record PageAssetDto(
        int pageNo,
        String url,
        LocalDateTime expiresAt,
        ImageResolution resolution,
        boolean watermarked,
        UUID generationId
) {
}
