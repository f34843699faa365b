package uk.gegc.comicmaker.features.asset.application;

import uk.gegc.comicmaker.features.asset.api.dto.PageAssetDto;
import uk.gegc.comicmaker.features.asset.api.dto.PdfAssetDto;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;

public interface DeliveryService {

    /**
     * Returns the project's PDF with a valid signed link, re-signing it when the stored one has
     * expired or was never set. Each call counts as one download.
     *
     * @throws uk.gegc.comicmaker.features.asset.domain.exception.DownloadNotAllowedException if the
     *         caller does not own the project
     * @throws uk.gegc.comicmaker.features.asset.domain.exception.AssetMissingException if no PDF exists
     */
    PdfAssetDto getDownloadUrl(User user, UUID projectId);

    List<PageAssetDto> listPages(User user, UUID projectId);
}
