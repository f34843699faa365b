package uk.gegc.comicmaker.features.asset.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "PdfAssetDto", description = "Compiled comic PDF with a time-limited download link")
public record PdfAssetDto(
        UUID projectId,
        String url,
        LocalDateTime expiresAt,
        int dpi,
        long fileSizeBytes,
        int pageCount,
        long downloadCount,
        LocalDateTime createdAt
) {
}
