package uk.gegc.comicmaker.features.asset.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.asset.api.dto.PageAssetDto;
import uk.gegc.comicmaker.features.asset.api.dto.PdfAssetDto;
import uk.gegc.comicmaker.features.asset.domain.model.ComicAsset;
import uk.gegc.comicmaker.features.asset.domain.model.PdfAsset;

@Component
public class AssetMapper {

    public PdfAssetDto toDto(PdfAsset asset) {
        return new PdfAssetDto(
                asset.getProjectId(),
                asset.getBlobUrl(),
                asset.getUrlExpiresAt(),
                asset.getDpi(),
                asset.getFileSizeBytes(),
                asset.getPageCount(),
                asset.getDownloadCount(),
                asset.getCreatedAt()
        );
    }

    public PageAssetDto toDto(ComicAsset asset) {
        return new PageAssetDto(
                asset.getPageNo(),
                asset.getBlobUrl(),
                asset.getUrlExpiresAt(),
                asset.getResolution(),
                asset.isWatermarked(),
                asset.getGenerationId()
        );
    }
}
