package uk.gegc.comicmaker.features.asset.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.asset.api.dto.PageAssetDto;
import uk.gegc.comicmaker.features.asset.api.dto.PdfAssetDto;
import uk.gegc.comicmaker.features.asset.application.BlobStorage;
import uk.gegc.comicmaker.features.asset.application.DeliveryService;
import uk.gegc.comicmaker.features.asset.domain.exception.AssetMissingException;
import uk.gegc.comicmaker.features.asset.domain.exception.DownloadNotAllowedException;
import uk.gegc.comicmaker.features.asset.domain.model.ComicAsset;
import uk.gegc.comicmaker.features.asset.domain.model.PdfAsset;
import uk.gegc.comicmaker.features.asset.domain.model.SignedUrl;
import uk.gegc.comicmaker.features.asset.domain.repository.ComicAssetRepository;
import uk.gegc.comicmaker.features.asset.domain.repository.PdfAssetRepository;
import uk.gegc.comicmaker.features.asset.infra.mapping.AssetMapper;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectNotFoundException;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryServiceImpl implements DeliveryService {

    private final ProjectRepository projectRepository;
    private final PdfAssetRepository pdfAssetRepository;
    private final ComicAssetRepository comicAssetRepository;
    private final BlobStorage blobStorage;
    private final AssetMapper assetMapper;
    private final Clock clock;

    @Override
    @Transactional
    public PdfAssetDto getDownloadUrl(User user, UUID projectId) {
        Project project = loadDownloadableProject(user, projectId);
        PdfAsset asset = pdfAssetRepository.findByProjectId(project.getId())
                .orElseThrow(() -> new AssetMissingException("No PDF has been compiled for project " + projectId));

        LocalDateTime now = LocalDateTime.now(clock);
        if (asset.isUrlExpired(now)) {
            SignedUrl signed = blobStorage.sign(asset.getBlobPath());
            asset.setBlobUrl(signed.url());
            asset.setUrlExpiresAt(signed.expiresAt());
            asset = pdfAssetRepository.save(asset);
            log.info("Refreshed PDF download URL for project {} (expires {})", projectId, signed.expiresAt());
        }

        // the update clears the persistence context, so the re-read sees the incremented count
        pdfAssetRepository.incrementDownloadCount(asset.getId());
        PdfAsset counted = pdfAssetRepository.findById(asset.getId()).orElse(asset);
        return assetMapper.toDto(counted);
    }

    @Override
    @Transactional
    public List<PageAssetDto> listPages(User user, UUID projectId) {
        Project project = loadDownloadableProject(user, projectId);
        List<ComicAsset> assets = comicAssetRepository.findByProjectIdOrderByPageNoAsc(project.getId());
        if (assets.isEmpty()) {
            throw new AssetMissingException("No pages have been generated for project " + projectId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        for (ComicAsset asset : assets) {
            if (asset.isUrlExpired(now)) {
                SignedUrl signed = blobStorage.sign(asset.getBlobPath());
                asset.setBlobUrl(signed.url());
                asset.setUrlExpiresAt(signed.expiresAt());
                comicAssetRepository.save(asset);
                log.debug("Refreshed URL for page {} of project {}", asset.getPageNo(), projectId);
            }
        }
        return assets.stream().map(assetMapper::toDto).toList();
    }

    private Project loadDownloadableProject(User user, UUID projectId) {
        Project project = projectRepository.findByIdAndDeletedAtIsNull(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        if (!project.getUserId().equals(user.getId())) {
            log.warn("User {} attempted to download assets of project {}", user.getId(), projectId);
            throw new DownloadNotAllowedException(projectId);
        }
        return project;
    }
}
