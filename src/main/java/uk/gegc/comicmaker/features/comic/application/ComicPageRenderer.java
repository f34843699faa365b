package uk.gegc.comicmaker.features.comic.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.comicmaker.features.asset.application.BlobPaths;
import uk.gegc.comicmaker.features.asset.application.BlobStorage;
import uk.gegc.comicmaker.features.asset.domain.model.ComicAsset;
import uk.gegc.comicmaker.features.asset.domain.model.SignedUrl;
import uk.gegc.comicmaker.features.asset.domain.repository.ComicAssetRepository;
import uk.gegc.comicmaker.features.comic.domain.exception.SceneStructureException;
import uk.gegc.comicmaker.features.comic.domain.model.ImageResolution;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.Scene;
import uk.gegc.comicmaker.features.project.domain.repository.SceneRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Renders one page: four panel images, composed, watermarked per plan, uploaded and recorded.
 * Provider calls and the upload run outside any transaction; only the scene and asset writes are
 * transactional.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComicPageRenderer {

    private static final String PNG = "image/png";

    private final SceneRepository sceneRepository;
    private final ComicAssetRepository comicAssetRepository;
    private final PanelPromptBuilder promptBuilder;
    private final ImageGenerationClient imageGenerationClient;
    private final PageComposer pageComposer;
    private final WatermarkService watermarkService;
    private final BlobStorage blobStorage;
    private final BlobPaths blobPaths;
    private final TransactionTemplate transactionTemplate;

    /**
     * @throws SceneStructureException if the page does not hold exactly panels 1..4
     */
    public ComicAsset renderPage(Project project, int pageNo, long seed, UUID generationId) {
        List<Scene> scenes = sceneRepository.findByProjectIdAndPageNoAndDeletedAtIsNullOrderByPanelNoAsc(project.getId(), pageNo);
        validatePanels(scenes, pageNo);

        ImageResolution resolution = ImageResolution.forPlan(project.getPlanSnapshot());
        List<byte[]> panels = new ArrayList<>(Scene.PANELS_PER_PAGE);
        for (Scene scene : scenes) {
            String prompt = promptBuilder.build(scene.getNarrativeText(), project.getConfig());
            panels.add(imageGenerationClient.generate(prompt, resolution, seed));
            scene.setPromptUsed(prompt);
        }

        byte[] page = pageComposer.compose(panels);
        boolean watermarked = watermarkService.shouldWatermark(project.getPlanSnapshot());
        if (watermarked) {
            page = watermarkService.apply(page, project.getPlanSnapshot());
        }

        String path = blobPaths.pagePath(project.getId(), pageNo);
        blobStorage.upload(path, page, PNG);
        SignedUrl signed = blobStorage.sign(path);

        ComicAsset saved = transactionTemplate.execute(status -> {
            sceneRepository.saveAll(scenes);
            ComicAsset asset = comicAssetRepository.findByProjectIdAndPageNo(project.getId(), pageNo)
                    .orElseGet(() -> {
                        ComicAsset created = new ComicAsset();
                        created.setProjectId(project.getId());
                        created.setPageNo(pageNo);
                        return created;
                    });
            asset.setBlobPath(path);
            asset.setBlobUrl(signed.url());
            asset.setUrlExpiresAt(signed.expiresAt());
            asset.setResolution(resolution);
            asset.setPlanSnapshot(project.getPlanSnapshot());
            asset.setWatermarked(watermarked);
            asset.setSeed(seed);
            asset.setGenerationId(generationId);
            return comicAssetRepository.save(asset);
        });
        log.info("Rendered page {} of project {} ({} bytes, {}, watermarked={})",
                pageNo, project.getId(), page.length, resolution, watermarked);
        return saved;
    }

    private void validatePanels(List<Scene> scenes, int pageNo) {
        if (scenes.size() != Scene.PANELS_PER_PAGE) {
            throw new SceneStructureException("Page " + pageNo + " must have exactly "
                    + Scene.PANELS_PER_PAGE + " panels, found " + scenes.size());
        }
        for (int i = 0; i < scenes.size(); i++) {
            if (scenes.get(i).getPanelNo() != i + 1) {
                throw new SceneStructureException("Page " + pageNo + " has an invalid panel layout: expected panel "
                        + (i + 1) + ", found " + scenes.get(i).getPanelNo());
            }
        }
    }
}
